package dev.codex.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class AdvisoryDocumentLockTest {

  @Mock PlatformTransactionManager transactionManager;

  @Mock JdbcTemplate jdbcTemplate;

  TransactionStatus status = new SimpleTransactionStatus();
  AdvisoryDocumentLock lock;

  @BeforeEach
  void setUp() {
    when(transactionManager.getTransaction(any())).thenReturn(status);
    lock = new AdvisoryDocumentLock(transactionManager, jdbcTemplate);
  }

  @Test
  void actionRunsAfterLockInsideTransaction() {
    Integer result =
        lock.withLock(
            "fl-test-101",
            () -> {
              verify(jdbcTemplate).queryForList(AdvisoryDocumentLock.LOCK_SQL, "fl-test-101");
              return 42;
            });

    assertThat(result).isEqualTo(42);
    InOrder order = inOrder(transactionManager, jdbcTemplate);
    order.verify(transactionManager).getTransaction(any());
    order.verify(jdbcTemplate).queryForList(AdvisoryDocumentLock.LOCK_SQL, "fl-test-101");
    order.verify(transactionManager).commit(status);
  }

  @Test
  void failingActionRollsBackAndReleasesLock() {
    assertThatThrownBy(
            () ->
                lock.withLock(
                    "fl-test-101",
                    () -> {
                      throw new IllegalStateException("insert failed");
                    }))
        .isInstanceOf(IllegalStateException.class);

    verify(transactionManager).rollback(status);
    verify(transactionManager, never()).commit(any());
  }
}
