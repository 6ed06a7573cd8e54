/*
 * どこで: 分散ロックライブラリ
 * 何を: 名前付きロックの取得/解放/延長を抽象化する
 * なぜ: 複数インスタンスで同じスケジュールジョブが重複実行されないようにするため
 */
package com.example.lock;

import java.time.Duration;

public interface DistributedLock {

  /**
   * 役割: lockType が未保持なら holderToken で ttl 付きで取得する。
   * 動作: 取得できなければ既存保持者の残り TTL を返す。ストアに到達できない場合は BACKEND_ERROR（未取得扱い）。
   * 前提: ttl は正の値。例外は投げず結果値で返す。
   */
  LockAcquisition acquire(String lockType, String holderToken, Duration ttl);

  /**
   * 役割: holderToken が現在の保持者である場合のみロックを解放する。
   * 動作: 照合と削除は単一の原子操作で行い、解放した場合 true。
   */
  boolean release(String lockType, String holderToken);

  /**
   * 役割: holderToken が現在の保持者である場合のみ期限を ttl に延長する。
   * 動作: 期限切れや他者保持なら false。
   */
  boolean renew(String lockType, String holderToken, Duration ttl);
}
