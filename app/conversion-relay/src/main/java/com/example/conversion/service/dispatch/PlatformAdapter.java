package com.example.conversion.service.dispatch;

import com.example.conversion.model.ConversionEvent;
import com.example.conversion.model.DeliveryResult;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformCredentials;

/**
 * 送信先ごとのアダプタ。
 *
 * <p>役割: 内部イベントを送信先のワイヤ形式へ変換して 1 回だけ送る。
 *
 * <p>前提: 例外は投げない。通信失敗/非 2xx/エラー本文はすべて {@link DeliveryResult#failure} で返す。
 */
public interface PlatformAdapter {

  Platform platform();

  DeliveryResult send(ConversionEvent event, PlatformCredentials credentials);
}
