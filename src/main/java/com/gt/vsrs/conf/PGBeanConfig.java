package com.gt.vsrs.conf;

import com.gt.vsrs.card.RetentionRecordDao;
import com.gt.vsrs.card.impl.RetentionRecordDaoPG;
import com.gt.vsrs.item.ItemDao;
import com.gt.vsrs.item.impl.ItemDaoPG;
import com.gt.vsrs.review.ReviewEventDao;
import com.gt.vsrs.review.impl.ReviewEventDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${vsrs.datasource.postgres.url}") String url,
                                    @Value("${vsrs.datasource.postgres.username}") String username,
                                    @Value("${vsrs.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager getTransactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate getTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);

        return transactionTemplate;
    }

    @Bean
    public ItemDao getItemDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ItemDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public RetentionRecordDao getRetentionRecordDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new RetentionRecordDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public ReviewEventDao getReviewEventDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ReviewEventDaoPG(namedParameterJdbcTemplate);
    }
}
