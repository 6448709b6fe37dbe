package com.nexus.config;

import com.nexus.common.exception.ErrorCode;
import com.nexus.common.exception.GraphStoreException;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * 服务层存储异常统一转换
 *
 * 位于事务拦截器外层，连接获取、语句执行、事务开启与提交中的故障都在这里转换：
 * 连接/瞬时故障与事务故障转换为 STORE_UNAVAILABLE，其余数据访问异常原样抛出。
 */
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class StoreExceptionAspect {

    private static final Logger logger = LoggerFactory.getLogger(StoreExceptionAspect.class);

    @Around("within(com.nexus.service..*)")
    public Object translateStoreFailures(ProceedingJoinPoint pjp) throws Throwable {
        try {
            return pjp.proceed();
        } catch (DataAccessException e) {
            throw translate(pjp, e);
        } catch (TransactionException e) {
            logger.error("存储事务失败: {}", pjp.getSignature().toShortString(), e);
            throw new GraphStoreException(ErrorCode.STORE_UNAVAILABLE, "存储事务失败: " + e.getMessage(), e);
        }
    }

    private RuntimeException translate(ProceedingJoinPoint pjp, DataAccessException e) {
        if (e instanceof DataAccessResourceFailureException || e instanceof TransientDataAccessException) {
            logger.error("存储不可用: {}", pjp.getSignature().toShortString(), e);
            return new GraphStoreException(ErrorCode.STORE_UNAVAILABLE, "存储不可用: " + e.getMessage(), e);
        }
        return e;
    }
}
