package com.chainindexer.api.controller;

import com.chainindexer.domain.BlockTransformSummaryRecordRepository;
import com.chainindexer.domain.DomainEventRecordRepository;
import com.chainindexer.domain.ProcessingErrorRecordRepository;
import com.chainindexer.ingestion.store.BlockTransformService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.List;

import static com.chainindexer.TestLogs.BLOCK;
import static com.chainindexer.TestLogs.TX_HASH;
import static com.chainindexer.TestLogs.ZERO;
import static com.chainindexer.TestLogs.erc20;
import static com.chainindexer.TestLogs.log;
import static com.chainindexer.TestLogs.tx;

@SpringBootTest
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class TransformControllerIntegrationTest {

    static final String WAVAX = "0xb31f66aa3c1e785363f0875a1b74e27b85fd66c7";
    static final String USDC = "0xb97ef9ef8734c71904d8002f8b6bc66dd9c48a6e";
    static final String PAIR = "0xf4003f4efbe8691b60249e6afbd307abe7758adb";
    static final String USER = "0x1111111111111111111111111111111111111111";

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    BlockTransformService blockTransformService;
    @Autowired
    DomainEventRecordRepository domainEventRecordRepository;
    @Autowired
    ProcessingErrorRecordRepository processingErrorRecordRepository;
    @Autowired
    BlockTransformSummaryRecordRepository blockTransformSummaryRecordRepository;

    @BeforeEach
    void seed() {
        domainEventRecordRepository.deleteAll();
        processingErrorRecordRepository.deleteAll();
        blockTransformSummaryRecordRepository.deleteAll();
        blockTransformService.transformAndStore(BLOCK, List.of(tx(
                erc20(0, WAVAX, USER, PAIR, 100),
                erc20(1, USDC, USER, PAIR, 200),
                erc20(2, PAIR, ZERO, USER, 50),
                log(3, PAIR, "Mint", "sender", USER, "amount0", 100, "amount1", 200),
                log(4, PAIR, "Burn", "sender", USER))));
    }

    @Test
    @DisplayName("events endpoint returns liquidity and position in log order, matched by any hash case")
    void events_returnsStoredEvents() {
        webTestClient.get()
                .uri("/api/v1/transactions/{txHash}/events", TX_HASH.toUpperCase().replace("0X", "0x"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.txHash").isEqualTo(TX_HASH)
                .jsonPath("$.events.length()").isEqualTo(2)
                .jsonPath("$.events[0].logIndex").isEqualTo(3)
                .jsonPath("$.events[?(@.eventType == 'liquidity')].payload.amount_base").isEqualTo("100");
    }

    @Test
    void errors_returnsProcessingErrors() {
        webTestClient.get()
                .uri("/api/v1/transactions/{txHash}/errors", TX_HASH)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.errors.length()").isEqualTo(1)
                .jsonPath("$.errors[0].errorType").isEqualTo("missing_attributes")
                .jsonPath("$.errors[0].logIndex").isEqualTo(4)
                .jsonPath("$.errors[0].transformerName").isEqualTo("ConstantProductPoolTransformer");
    }

    @Test
    void blockSummary_returnsCounts() {
        webTestClient.get()
                .uri("/api/v1/blocks/{blockNumber}/summary", BLOCK)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.blockNumber").isEqualTo(1000)
                .jsonPath("$.transactions").isEqualTo(1)
                .jsonPath("$.erroredTransactions").isEqualTo(1)
                .jsonPath("$.positions").isEqualTo(1);
    }

    @Test
    void blockSummary_unknownBlock_is404() {
        webTestClient.get()
                .uri("/api/v1/blocks/{blockNumber}/summary", 424242)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo(TransformController.BLOCK_NOT_FOUND);
    }

    @Test
    @DisplayName("malformed tx hash is rejected with INVALID_TX_HASH")
    void events_invalidHash_is400() {
        webTestClient.get()
                .uri("/api/v1/transactions/{txHash}/events", "0x1234")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_TX_HASH");
    }
}
