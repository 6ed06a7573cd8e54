/*
 * どこで: 分散ロックライブラリ（Redis 実装）
 * 何を: SET NX PX と Lua による照合付き DEL/PEXPIRE でロックを実装する
 * なぜ: 期限切れ直前の解放で他インスタンスのロックを消さないようにするため
 */
package com.example.lock;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

public class RedisDistributedLock implements DistributedLock {

  private static final Logger logger = LoggerFactory.getLogger(RedisDistributedLock.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final String keyPrefix;
  @SuppressWarnings("rawtypes")
  private final DefaultRedisScript<List> acquireScript;
  private final DefaultRedisScript<Long> releaseScript;
  private final DefaultRedisScript<Long> renewScript;

  public RedisDistributedLock(StringRedisTemplate redisTemplate, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    this.acquireScript = new DefaultRedisScript<>();
    this.acquireScript.setLocation(new ClassPathResource("lock/acquire.lua"));
    this.acquireScript.setResultType(List.class);
    this.releaseScript = loadLongScript("lock/release.lua");
    this.renewScript = loadLongScript("lock/renew.lua");
  }

  public static String lockKey(String keyPrefix, String lockType) {
    return keyPrefix + "lock:" + lockType;
  }

  @Override
  public LockAcquisition acquire(String lockType, String holderToken, Duration ttl) {
    final List<String> keys = List.of(lockKey(keyPrefix, lockType));
    final List<?> result;
    try {
      result =
          redisTemplate.execute(acquireScript, keys, holderToken, Long.toString(ttl.toMillis()));
    } catch (DataAccessException ex) {
      // ストア不達は未取得として扱う（重複実行より停止を選ぶ）
      logger.warn("lock acquire failed closed lockType={}", lockType, ex);
      return LockAcquisition.backendError("lock_backend_error: " + ex.getClass().getSimpleName());
    }
    if (result == null || result.size() < 2) {
      logger.warn("lock acquire returned unexpected reply lockType={} reply={}", lockType, result);
      return LockAcquisition.backendError("lock_backend_error: unexpected reply");
    }
    final long flag = toLong(result.get(0));
    final long millis = toLong(result.get(1));
    if (flag == 1L) {
      return LockAcquisition.acquired(ttl);
    }
    return LockAcquisition.heldElsewhere(Duration.ofMillis(Math.max(millis, 1L)));
  }

  @Override
  public boolean release(String lockType, String holderToken) {
    try {
      final Long res =
          redisTemplate.execute(releaseScript, List.of(lockKey(keyPrefix, lockType)), holderToken);
      return Long.valueOf(1L).equals(res);
    } catch (DataAccessException ex) {
      // 解放できなくても TTL で自然失効する
      logger.warn("lock release failed lockType={}", lockType, ex);
      return false;
    }
  }

  @Override
  public boolean renew(String lockType, String holderToken, Duration ttl) {
    try {
      final Long res =
          redisTemplate.execute(
              renewScript,
              List.of(lockKey(keyPrefix, lockType)),
              holderToken,
              Long.toString(ttl.toMillis()));
      return Long.valueOf(1L).equals(res);
    } catch (DataAccessException ex) {
      logger.warn("lock renew failed lockType={}", lockType, ex);
      return false;
    }
  }

  private long toLong(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    return value == null ? 0L : Long.parseLong(String.valueOf(value));
  }

  private static DefaultRedisScript<Long> loadLongScript(String path) {
    final DefaultRedisScript<Long> script = new DefaultRedisScript<>();
    script.setLocation(new ClassPathResource(path));
    script.setResultType(Long.class);
    return script;
  }
}
