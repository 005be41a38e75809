package com.flagship.topup_gateway.topup;

import com.flagship.topup_gateway.topup.dto.CreateTopupRequest;
import com.flagship.topup_gateway.topup.dto.TopupResponse;
import com.flagship.topup_gateway.topup.dto.UpdateTopupRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST adapter for topup commands and reads.
 *
 * Request binding and validation only; work happens in
 * {@link TopupCommandService} and {@link TopupQueryService}. Failures are
 * rendered by the exception handler.
 */
@RestController
@RequestMapping("/api/topups")
@RequiredArgsConstructor
@Slf4j
public class TopupController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TopupCommandService commandService;
    private final TopupQueryService queryService;

    /**
     * Creates a topup and credits the card's saldo.
     *
     * @param idempotencyKey optional; a repeated key returns the first result
     */
    @PostMapping
    public ResponseEntity<TopupResponse> createTopup(
            @Valid @RequestBody CreateTopupRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received topup request: amount={}, method={}, idempotencyKey={}",
                request.getTopupAmount(), request.getTopupMethod(), idempotencyKey);

        TopupResponse response = commandService.createTopup(request, idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{id}")
    public ResponseEntity<TopupResponse> updateTopup(@PathVariable("id") long id,
                                                     @Valid @RequestBody UpdateTopupRequest request) {
        return ResponseEntity.ok(commandService.updateTopup(request.withTopupId(id)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TopupResponse> getTopup(@PathVariable("id") long id) {
        return ResponseEntity.ok(queryService.findById(id));
    }

    @PostMapping("/{id}/trash")
    public ResponseEntity<TopupResponse> trashTopup(@PathVariable("id") long id) {
        return ResponseEntity.ok(commandService.trashTopup(id));
    }

    @PostMapping("/{id}/restore")
    public ResponseEntity<TopupResponse> restoreTopup(@PathVariable("id") long id) {
        return ResponseEntity.ok(commandService.restoreTopup(id));
    }

    @DeleteMapping("/{id}/permanent")
    public ResponseEntity<Void> deleteTopupPermanent(@PathVariable("id") long id) {
        commandService.deleteTopupPermanent(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/restore-all")
    public ResponseEntity<Map<String, Integer>> restoreAllTopup() {
        return ResponseEntity.ok(Map.of("restored", commandService.restoreAllTopup()));
    }

    @DeleteMapping("/permanent")
    public ResponseEntity<Map<String, Integer>> deleteAllTopupPermanent() {
        return ResponseEntity.ok(Map.of("deleted", commandService.deleteAllTopupPermanent()));
    }
}
