package com.example.conversion.service;

import com.example.conversion.model.ResolvedShop;
import com.example.conversion.repository.PlatformConfigRepository;
import com.example.conversion.repository.ShopRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ShopResolver {

  private final ShopRepository shopRepository;
  private final PlatformConfigRepository platformConfigRepository;

  /** 有効なショップと有効なプラットフォーム設定を読む。未登録/無効なら empty。 */
  public Optional<ResolvedShop> resolve(String shopDomain) {
    return shopRepository
        .findActiveByDomain(shopDomain)
        .map(shop -> new ResolvedShop(shop, platformConfigRepository.findActiveByShop(shop.id())));
  }
}
