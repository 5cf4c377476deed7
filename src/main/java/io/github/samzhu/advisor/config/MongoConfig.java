package io.github.samzhu.advisor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>啟用以下功能：
 * <ul>
 *   <li>Repository 自動掃描 - 自動註冊 {@code io.github.samzhu.advisor.repository} 下的介面</li>
 *   <li>交易管理 - 基準線重算與建議狀態變更在單一交易內完成，失敗時完整回滾</li>
 * </ul>
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code usage_events} - 用量事件（唯讀，由 ingestion pipeline 寫入）</li>
 *   <li>{@code project_baselines} - (project, agent, model) 統計基準線</li>
 *   <li>{@code recommendations} - 已持久化的優化建議</li>
 * </ul>
 *
 * <p>MongoDB 交易需要 replica set 部署。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/client-session-transactions.html">Sessions &amp; Transactions</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.advisor.repository")
public class MongoConfig {

    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }
}
