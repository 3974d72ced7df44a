package net.jobclaim.integration.spring.tx;

import net.jobclaim.adapter.jdbc.TxContext;
import net.jobclaim.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 위에서 TxContext 를 채워 주는 TxRunner.
 * 본문이 던진 예외는 롤백 후 그대로 다시 던진다(체크 예외 포함).
 */
public final class SpringTxRunner implements TxRunner {
    private final DataSource ds;
    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.ds = ds;
        this.required = template(tm, TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNew = template(tm, TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(required, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(requiresNew, body);
    }

    private <T> T execute(TransactionTemplate tpl, Callable<T> body) throws Exception {
        try {
            return tpl.execute(status -> {
                // REQUIRES_NEW 면 바깥과 다른 커넥션이 나온다. 끝나면 바깥 것을 되돌려 놓는다
                Connection outer = TxContext.get();
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CheckedBodyException(e);
                } finally {
                    if (outer != null) TxContext.set(outer);
                    else TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedBodyException e) {
            throw (Exception) e.getCause();
        }
    }

    private static TransactionTemplate template(PlatformTransactionManager tm, int propagation) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        return tpl;
    }

    /** TransactionCallback 을 빠져나가기 위한 포장. 밖으로 새지 않는다. */
    private static final class CheckedBodyException extends RuntimeException {
        CheckedBodyException(Exception cause) {
            super(cause);
        }
    }
}
