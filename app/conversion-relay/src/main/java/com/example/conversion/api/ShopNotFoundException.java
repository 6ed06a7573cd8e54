package com.example.conversion.api;

public class ShopNotFoundException extends RuntimeException {
  public ShopNotFoundException(String shopId) {
    super("shop not found: " + shopId);
  }
}
