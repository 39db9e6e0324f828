package com.ryuqq.packsync.adapter.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.packsync.adapter.registry.dto.ServerListResponse;
import com.ryuqq.packsync.adapter.registry.dto.ServerResponse;
import com.ryuqq.packsync.core.model.ServerPage;
import com.ryuqq.packsync.core.model.ServerRecord;
import com.ryuqq.packsync.core.model.ServerStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RegistryRecordMapper 변환 규칙 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RegistryRecordMapperTest {

    private final ObjectMapper objectMapper = RegistryClient.defaultObjectMapper();

    @Test
    void snake_case_필드와_최상위_status_지원() throws Exception {
        // given
        String json = "{\"servers\":[{\"name\":\"acme/widget\",\"version\":\"1.0.0\",\"status\":\"deprecated\","
            + "\"packages\":[{\"registry_type\":\"npm\",\"identifier\":\"w\",\"transport\":{\"type\":\"stdio\"}}],"
            + "\"unknown\":{\"nested\":true}}],"
            + "\"metadata\":{\"count\":1,\"next_cursor\":\"n2\"}}";

        // when
        ServerPage page = RegistryRecordMapper.toPage(objectMapper.readValue(json, ServerListResponse.class));

        // then
        assertThat(page.nextCursor()).isEqualTo("n2");
        ServerRecord record = page.servers().get(0);
        assertThat(record.status()).isEqualTo(ServerStatus.DEPRECATED);
        assertThat(record.packages()).singleElement()
            .satisfies(pkg -> assertThat(pkg.registryType()).isEqualTo("npm"));
    }

    @Test
    void 메타데이터_없으면_ACTIVE_그리고_registryType_없는_패키지는_제외() throws Exception {
        // given
        String json = "{\"name\":\"acme/widget\",\"version\":\"1.0.0\","
            + "\"packages\":[{\"identifier\":\"orphan\"},{\"registryType\":\"oci\",\"identifier\":\"img\"}]}";

        // when
        ServerRecord record = RegistryRecordMapper.toRecord(objectMapper.readValue(json, ServerResponse.class));

        // then
        assertThat(record.status()).isEqualTo(ServerStatus.ACTIVE);
        assertThat(record.packages()).singleElement().satisfies(pkg -> {
            assertThat(pkg.registryType()).isEqualTo("oci");
            assertThat(pkg.transportType()).isEmpty();
        });
    }

    @Test
    void 알수없는_status는_DELETED_그리고_잘못된_updatedAt은_무시() throws Exception {
        // given
        String json = "{\"server\":{\"name\":\"acme/widget\",\"version\":\"1.0.0\"},"
            + "\"_meta\":{\"io.modelcontextprotocol.registry/official\":{\"status\":\"archived\",\"updatedAt\":\"yesterday\"}}}";

        // when
        ServerRecord record = RegistryRecordMapper.toRecord(objectMapper.readValue(json, ServerResponse.class));

        // then
        assertThat(record.status()).isEqualTo(ServerStatus.DELETED);
        assertThat(record.updatedAt()).isNull();
    }
}
