/*
 * どこで: Conversion Relay アプリのスモークテスト
 * 何を: Spring コンテキストの起動を確認する
 * なぜ: 設定クラスや条件付き Bean の組み合わせが壊れていないことを担保するため
 */
package com.example.conversion;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.conversion.service.IngestionService;
import com.example.conversion.service.dispatch.DispatchRouter;
import com.example.lock.LockManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ConversionApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private IngestionService ingestionService;
  @Autowired private DispatchRouter dispatchRouter;
  @Autowired private LockManager lockManager;

  @Test
  void contextLoads() {
    assertThat(ingestionService).isNotNull();
    assertThat(dispatchRouter).isNotNull();
    assertThat(lockManager).isNotNull();
  }
}
