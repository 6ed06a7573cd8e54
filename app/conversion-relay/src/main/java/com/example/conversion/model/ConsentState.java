package com.example.conversion.model;

/** 受信した同意シグナル。null は「未送信」で、false と同じく許可とはみなさない。 */
public record ConsentState(Boolean marketing, Boolean analytics, Boolean saleOfData) {

  public static final ConsentState NONE = new ConsentState(null, null, null);

  public boolean marketingGranted() {
    return Boolean.TRUE.equals(marketing);
  }

  public boolean analyticsGranted() {
    return Boolean.TRUE.equals(analytics);
  }

  public boolean saleOfDataGranted() {
    return Boolean.TRUE.equals(saleOfData);
  }
}
