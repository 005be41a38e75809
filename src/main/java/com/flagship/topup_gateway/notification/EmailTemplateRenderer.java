package com.flagship.topup_gateway.notification;

import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders the fixed transactional e-mail layout.
 *
 * All values are HTML-escaped before substitution.
 */
@Component
public class EmailTemplateRenderer {

    private static final String TEMPLATE = """
        <!DOCTYPE html>
        <html>
        <head>
          <meta charset="UTF-8">
          <title>%1$s</title>
        </head>
        <body style="margin:0;padding:0;background-color:#f4f4f7;font-family:Arial,Helvetica,sans-serif;">
          <table width="100%%" cellpadding="0" cellspacing="0" style="padding:24px 0;">
            <tr>
              <td align="center">
                <table width="600" cellpadding="0" cellspacing="0" style="background-color:#ffffff;border-radius:8px;padding:32px;">
                  <tr>
                    <td>
                      <h1 style="color:#333333;font-size:22px;margin:0 0 16px;">%1$s</h1>
                      <p style="color:#51545e;font-size:16px;line-height:1.5;margin:0 0 24px;">%2$s</p>
                      <a href="%4$s" style="display:inline-block;background-color:#3869d4;color:#ffffff;padding:12px 24px;border-radius:4px;text-decoration:none;">%3$s</a>
                    </td>
                  </tr>
                </table>
              </td>
            </tr>
          </table>
        </body>
        </html>
        """;

    public String render(String title, String message, String buttonLabel, String link) {
        return String.format(TEMPLATE,
            HtmlUtils.htmlEscape(nullToEmpty(title)),
            HtmlUtils.htmlEscape(nullToEmpty(message)),
            HtmlUtils.htmlEscape(nullToEmpty(buttonLabel)),
            HtmlUtils.htmlEscape(nullToEmpty(link)));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
