package com.licensor.infrastructure.tx;

import com.licensor.application.ports.RepositoryException;
import com.licensor.application.ports.UnitOfWork;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * UnitOfWork backed by a Spring transaction. Commit-time failures (constraint violations,
 * lock timeouts) surface as RepositoryException; exceptions thrown by the work itself roll back
 * and propagate unchanged.
 */
@Component
public class SpringUnitOfWork implements UnitOfWork {

  private final TransactionTemplate tx;

  public SpringUnitOfWork(PlatformTransactionManager transactionManager) {
    this.tx = new TransactionTemplate(transactionManager);
  }

  @Override
  public <T> T execute(Supplier<T> work) {
    try {
      return tx.execute(status -> work.get());
    } catch (TransactionException | DataAccessException e) {
      throw new RepositoryException("Transaction failed", e);
    }
  }
}
