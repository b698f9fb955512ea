package recurrent.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import recurrent.expiry.ExpirySweeper;
import recurrent.jdbc.DataSourceConnectionProvider;
import recurrent.jdbc.TableNames;
import recurrent.jdbc.lock.JdbcDistributedLocks;
import recurrent.jdbc.purge.AbstractJdbcExpiryPurger;
import recurrent.jdbc.purge.JdbcExpiryPurgers;
import recurrent.jdbc.store.JdbcRecurringJobStore;
import recurrent.retry.ExponentialBackoffRetryPolicy;
import recurrent.schedule.RecurringJobFactory;
import recurrent.schedule.RecurringJobManager;
import recurrent.schedule.RecurringJobProcessor;
import recurrent.spi.ConnectionProvider;
import recurrent.spi.CronEvaluator;
import recurrent.spi.DistributedLock;
import recurrent.spi.ExpiryPurger;
import recurrent.spi.JobTrigger;
import recurrent.spi.MetricsExporter;
import recurrent.spi.RecurringJobStore;
import recurrent.spring.SpringCronEvaluator;

import javax.sql.DataSource;

/**
 * Auto-configuration for expiry sweeping and recurring job processing.
 *
 * <p>Wires the JDBC purger, lock and store detected from the {@link DataSource}.
 * The {@link ExpirySweeper} starts with the context unless
 * {@code recurrent.expiry.enabled=false}. The {@link RecurringJobProcessor}
 * starts only when {@code recurrent.schedule.enabled=true} and a
 * {@link JobTrigger} bean exists; the {@link RecurringJobManager} is always
 * available for maintaining definitions.
 *
 * @see RecurrentProperties
 * @see RecurrentMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(ExpirySweeper.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RecurrentProperties.class)
public class RecurrentAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TableNames recurrentTableNames(RecurrentProperties props) {
        return TableNames.withPrefix(props.getTablePrefix());
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider recurrentConnectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(DistributedLock.class)
    public DistributedLock recurrentDistributedLock(DataSource dataSource, TableNames tableNames,
                                                    RecurrentProperties props) {
        return switch (props.getLock().getType()) {
            case TABLE -> JdbcDistributedLocks.table(tableNames);
            case ADVISORY -> JdbcDistributedLocks.nativeOrTable(JdbcExpiryPurgers.jdbcUrl(dataSource), tableNames);
        };
    }

    @Bean
    @ConditionalOnMissingBean(ExpiryPurger.class)
    public AbstractJdbcExpiryPurger expiryPurger(DataSource dataSource, TableNames tableNames) {
        return JdbcExpiryPurgers.detect(dataSource, tableNames);
    }

    @Bean
    @ConditionalOnMissingBean(CronEvaluator.class)
    public SpringCronEvaluator cronEvaluator() {
        return new SpringCronEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean(RecurringJobStore.class)
    public JdbcRecurringJobStore recurringJobStore(TableNames tableNames) {
        return new JdbcRecurringJobStore(tableNames);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecurringJobFactory recurringJobFactory(CronEvaluator cronEvaluator, RecurrentProperties props) {
        return RecurringJobFactory.builder()
                .cronEvaluator(cronEvaluator)
                .defaultTimeZone(props.getSchedule().getDefaultTimeZone())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecurringJobManager recurringJobManager(ConnectionProvider connectionProvider,
                                                   RecurringJobStore store,
                                                   DistributedLock lock,
                                                   RecurringJobFactory factory) {
        return RecurringJobManager.builder()
                .connectionProvider(connectionProvider)
                .store(store)
                .lock(lock)
                .factory(factory)
                .build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "recurrent.expiry", name = "enabled", matchIfMissing = true)
    public ExpirySweeper expirySweeper(RecurrentProperties props,
                                       ConnectionProvider connectionProvider,
                                       ExpiryPurger purger,
                                       DistributedLock lock,
                                       ObjectProvider<MetricsExporter> metricsProvider) {
        RecurrentProperties.Expiry expiry = props.getExpiry();
        return ExpirySweeper.builder()
                .connectionProvider(connectionProvider)
                .purger(purger)
                .lock(lock)
                .batchSize(expiry.getBatchSize())
                .stateRetention(expiry.getStateRetention())
                .interval(expiry.getInterval())
                .lockTimeout(expiry.getLockTimeout())
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(JobTrigger.class)
    @ConditionalOnProperty(prefix = "recurrent.schedule", name = "enabled", havingValue = "true")
    public RecurringJobProcessor recurringJobProcessor(RecurrentProperties props,
                                                       ConnectionProvider connectionProvider,
                                                       RecurringJobStore store,
                                                       DistributedLock lock,
                                                       RecurringJobFactory factory,
                                                       JobTrigger trigger,
                                                       ObjectProvider<MetricsExporter> metricsProvider) {
        RecurrentProperties.Schedule schedule = props.getSchedule();
        return RecurringJobProcessor.builder()
                .connectionProvider(connectionProvider)
                .store(store)
                .lock(lock)
                .factory(factory)
                .trigger(trigger)
                .retryPolicy(new ExponentialBackoffRetryPolicy(
                        schedule.getRetry().getBaseDelay(), schedule.getRetry().getMaxDelay()))
                .maxRetryAttempts(schedule.getMaxRetryAttempts())
                .batchSize(schedule.getBatchSize())
                .precision(schedule.getPrecision())
                .interval(schedule.getInterval())
                .lockTimeout(schedule.getLockTimeout())
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }
}
