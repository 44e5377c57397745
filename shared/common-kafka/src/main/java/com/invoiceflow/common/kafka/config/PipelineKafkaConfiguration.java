package com.invoiceflow.common.kafka.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;

import com.invoiceflow.common.kafka.KafkaTopics;

/**
 * Producer, consumer, admin and listener container wiring shared by every pipeline service.
 * Consumers commit manually, one record at a time, after the handler has finished.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineKafkaConfiguration {

    static final String BOOTSTRAP_SERVERS_PROPERTY = "spring.kafka.bootstrap-servers";

    @Bean
    public ProducerFactory<String, String> stringProducerFactory(Environment environment,
            PipelineProperties properties) {
        Map<String, Object> producerProps = new HashMap<>(connectionProps(environment, properties));
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        // Publisher confirms: wait for all in-sync replicas, no duplicates on producer retry.
        producerProps.put(ProducerConfig.ACKS_CONFIG, environment.getProperty("spring.kafka.producer.acks", "all"));
        producerProps.put(
                ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG,
                Boolean.parseBoolean(environment.getProperty("spring.kafka.producer.enable-idempotence", "true")));

        // send() must not block longer than the publish timeout waiting for metadata
        producerProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, properties.getPublishTimeout().toMillis());

        String lingerMs = environment.getProperty("spring.kafka.producer.properties.linger.ms");
        if (lingerMs != null && !lingerMs.isBlank()) {
            producerProps.put(ProducerConfig.LINGER_MS_CONFIG, Integer.parseInt(lingerMs));
        }

        return new DefaultKafkaProducerFactory<>(producerProps);
    }

    @Bean
    public KafkaTemplate<String, String> kafkaTemplate(ProducerFactory<String, String> stringProducerFactory) {
        KafkaTemplate<String, String> template = new KafkaTemplate<>(stringProducerFactory);
        template.setObservationEnabled(true);
        return template;
    }

    @Bean
    public ConsumerFactory<String, String> stringConsumerFactory(Environment environment,
            PipelineProperties properties) {
        Map<String, Object> consumerProps = new HashMap<>(connectionProps(environment, properties));
        consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG,
                environment.getProperty("spring.kafka.consumer.group-id", properties.getServiceName()));
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG,
                environment.getProperty("spring.kafka.consumer.auto-offset-reset", "earliest"));
        consumerProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, properties.getPrefetchLimit());

        return new DefaultKafkaConsumerFactory<>(consumerProps);
    }

    /**
     * Container factory used by every {@code @KafkaListener} in the pipeline.
     * Concurrency equals the prefetch limit, so at most that many handlers run at once.
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> stringConsumerFactory,
            PipelineProperties properties) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(stringConsumerFactory);
        factory.setConcurrency(properties.getPrefetchLimit());

        ContainerProperties containerProperties = factory.getContainerProperties();
        containerProperties.setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        containerProperties.setShutdownTimeout(properties.getShutdownGracePeriod().toMillis());
        containerProperties.setObservationEnabled(true);
        return factory;
    }

    @Bean
    public KafkaAdmin kafkaAdmin(Environment environment, PipelineProperties properties) {
        KafkaAdmin admin = new KafkaAdmin(connectionProps(environment, properties));
        // BrokerTopologyInitializer owns the retry loop
        admin.setFatalIfBrokerNotAvailable(false);
        return admin;
    }

    @Bean
    public KafkaAdmin.NewTopics pipelineTopics(PipelineProperties properties) {
        PipelineProperties.Topology topology = properties.getTopology();
        List<NewTopic> topics = new ArrayList<>();
        for (String topic : topology.getTopics()) {
            topics.add(newTopic(topic, topology));
            if (topology.isDeclareDeadLetterTopics()) {
                topics.add(newTopic(KafkaTopics.deadLetterTopic(topic), topology));
            }
        }
        return new KafkaAdmin.NewTopics(topics.toArray(new NewTopic[0]));
    }

    private static NewTopic newTopic(String name, PipelineProperties.Topology topology) {
        return TopicBuilder.name(name)
                .partitions(topology.getPartitions())
                .replicas(topology.getReplicas())
                .build();
    }

    static Map<String, Object> connectionProps(Environment environment, PipelineProperties properties) {
        Map<String, Object> props = new HashMap<>();
        props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG,
                environment.getProperty(BOOTSTRAP_SERVERS_PROPERTY, "localhost:9092"));
        props.put(CommonClientConfigs.RECONNECT_BACKOFF_MS_CONFIG,
                properties.getReconnectBackoff().getInitial().toMillis());
        props.put(CommonClientConfigs.RECONNECT_BACKOFF_MAX_MS_CONFIG,
                properties.getReconnectBackoff().getMax().toMillis());
        return props;
    }
}
