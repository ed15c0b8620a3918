package org.lite.ai.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.mongodb.ReactiveMongoDatabaseFactory;
import org.springframework.data.mongodb.config.AbstractReactiveMongoConfiguration;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.convert.DefaultMongoTypeMapper;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;
import org.springframework.lang.NonNull;

import java.util.concurrent.TimeUnit;

@Configuration
@Profile("!in-memory")
@EnableReactiveMongoRepositories(basePackages = "org.lite.ai.repository")
@Slf4j
public class MongoReactiveConfig extends AbstractReactiveMongoConfiguration {

    @Value("${spring.data.mongodb.uri}")
    private String mongoUri;

    @Value("${spring.data.mongodb.database}")
    private String databaseName;

    @Override
    protected @NonNull String getDatabaseName() {
        return databaseName;
    }

    // unique indexes back idempotent ingestion and label uniqueness
    @Override
    protected boolean autoIndexCreation() {
        return true;
    }

    @Override
    @Bean
    public @NonNull MongoClient reactiveMongoClient() {
        log.info("🚀 Connecting to MongoDB database {}", databaseName);
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(mongoUri))
                .applicationName("linqra-ai-gateway")
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(10, TimeUnit.SECONDS))
                .build();
        return MongoClients.create(settings);
    }

    @Bean
    @Override
    public @NonNull ReactiveMongoTemplate reactiveMongoTemplate(@NonNull ReactiveMongoDatabaseFactory databaseFactory,
                                                                @NonNull MappingMongoConverter converter) {
        converter.setTypeMapper(new DefaultMongoTypeMapper(null));
        return new ReactiveMongoTemplate(databaseFactory, converter);
    }

    @Bean
    @Override
    public @NonNull MappingMongoConverter mappingMongoConverter(
            @NonNull ReactiveMongoDatabaseFactory databaseFactory,
            @NonNull MongoCustomConversions customConversions,
            @NonNull MongoMappingContext mappingContext) {

        MappingMongoConverter converter = super.mappingMongoConverter(databaseFactory, customConversions,
                mappingContext);
        converter.setMapKeyDotReplacement("_"); // metadata keys may contain dots
        return converter;
    }
}
