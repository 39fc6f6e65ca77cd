package com.williamcallahan.esvector.config;

import com.williamcallahan.esvector.client.DocumentStoreClient;
import com.williamcallahan.esvector.client.RestDocumentStoreClient;
import com.williamcallahan.esvector.collection.CollectionOptions;
import com.williamcallahan.esvector.collection.ElasticsearchVectorStore;
import com.williamcallahan.esvector.embedding.SpringAiEmbeddingGenerator;
import com.williamcallahan.esvector.mapping.StorageObjectMappers;
import com.williamcallahan.esvector.search.SearchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration exposing the Elasticsearch client and vector store.
 *
 * <p>An {@link EmbeddingModel} bean, when present, becomes the store-wide default embedding generator.
 * The storage mapper is kept private to the store so the application's own Jackson configuration is
 * never affected.</p>
 */
@AutoConfiguration
@EnableConfigurationProperties(VectorStoreProperties.class)
public class VectorStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public DocumentStoreClient documentStoreClient(
            VectorStoreProperties properties, ObjectProvider<RestTemplateBuilder> restTemplateBuilder) {
        properties.validateConfiguration();
        log.info("[ES] Using Elasticsearch at {}", properties.getUrl());
        return new RestDocumentStoreClient(
                properties.getUrl(),
                properties.getApiKey(),
                properties.getConnectTimeout(),
                properties.getReadTimeout(),
                properties.getRefresh(),
                StorageObjectMappers.create(),
                restTemplateBuilder.getIfAvailable(RestTemplateBuilder::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ElasticsearchVectorStore elasticsearchVectorStore(
            DocumentStoreClient documentStoreClient,
            VectorStoreProperties properties,
            ObjectProvider<EmbeddingModel> embeddingModel) {
        properties.validateConfiguration();
        VectorStoreProperties.Search search = properties.getSearch();
        CollectionOptions options = CollectionOptions.defaults()
                .withObjectMapper(StorageObjectMappers.create(properties.getNamingStrategy().jacksonStrategy()))
                .withSearchSettings(new SearchSettings(
                        search.getNumCandidatesFactor(), search.getRankWindowSize(), search.getRankConstant()));
        EmbeddingModel model = embeddingModel.getIfUnique();
        if (model != null) {
            log.info("[EMBEDDING] Using {} as default embedding generator", model.getClass().getSimpleName());
            options = options.withEmbeddingGenerator(new SpringAiEmbeddingGenerator(model));
        }
        // the client bean is container-managed, so the store only borrows it
        return new ElasticsearchVectorStore(documentStoreClient, false, options);
    }
}
