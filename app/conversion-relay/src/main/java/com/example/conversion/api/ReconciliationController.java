package com.example.conversion.api;

import com.example.conversion.model.ReconciliationReport;
import com.example.conversion.repository.ShopRepository;
import com.example.conversion.service.ReconciliationService;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** ショップ単位の突合レポートを返す内部 API。 */
@RestController
@RequiredArgsConstructor
public class ReconciliationController {

  private final ReconciliationService reconciliationService;
  private final ShopRepository shopRepository;

  @GetMapping("/internal/shops/{shopId}/reconciliation")
  public ResponseEntity<ReconciliationReport> reconcile(
      @PathVariable("shopId") UUID shopId,
      @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
      @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
    if (shopRepository.findById(shopId).isEmpty()) {
      throw new ShopNotFoundException(shopId.toString());
    }
    return ResponseEntity.ok(reconciliationService.reconcile(shopId, from, to));
  }
}
