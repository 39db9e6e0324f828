package com.ryuqq.packsync.core.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 필터 파싱 및 일치 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("필터 파싱 테스트")
class FilterParsingTest {

    // ============================================================
    // ServerNameFilter
    // ============================================================

    @Test
    @DisplayName("이름 목록은 공백 제거, 빈 항목 제외, 순서 유지 중복 제거된다")
    void nameFilter_parse_normalizes() {
        // when
        ServerNameFilter filter = ServerNameFilter.parse(" acme/widget, ,io.x/y,acme/widget ");

        // then
        assertThat(filter.names()).containsExactly("acme/widget", "io.x/y");
        assertThat(filter.matches("acme/widget")).isTrue();
        assertThat(filter.matches("acme/gadget")).isFalse();
    }

    @Test
    @DisplayName("빈 이름 필터는 모든 서버와 일치한다")
    void nameFilter_empty_matchesAll() {
        // when
        ServerNameFilter filter = ServerNameFilter.parse("");

        // then
        assertThat(filter.isEmpty()).isTrue();
        assertThat(filter.matches("anything/goes")).isTrue();
        assertThat(ServerNameFilter.matchAll().matches("acme/widget")).isTrue();
    }

    @Test
    @DisplayName("형식이 잘못된 이름은 거부된다")
    void nameFilter_malformed_rejected() {
        assertThatThrownBy(() -> ServerNameFilter.parse("acme/widget,broken"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("broken");
    }

    // ============================================================
    // PackageTypeFilter
    // ============================================================

    @Test
    @DisplayName("패키지 타입은 대소문자를 무시한다")
    void packageTypeFilter_caseInsensitive() {
        // when
        PackageTypeFilter filter = PackageTypeFilter.parse("NPM, oci");

        // then
        assertThat(filter.types()).containsExactly("npm", "oci");
        assertThat(filter.matches("npm")).isTrue();
        assertThat(filter.matches("Npm")).isTrue();
        assertThat(filter.matches("pypi")).isFalse();
        assertThat(filter.matches(null)).isFalse();
    }

    @Test
    @DisplayName("지원하지 않는 패키지 타입과 빈 입력은 거부된다")
    void packageTypeFilter_invalid_rejected() {
        assertThatThrownBy(() -> PackageTypeFilter.parse("npm,cargo"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cargo");
        assertThatThrownBy(() -> PackageTypeFilter.parse(" , "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least one package type");
    }

    @Test
    @DisplayName("all() 은 지원하는 모든 패키지 타입을 허용한다")
    void packageTypeFilter_all() {
        assertThat(PackageTypeFilter.all().types()).containsExactlyElementsOf(PackageTypeFilter.VALID);
    }

    // ============================================================
    // TransportTypeFilter / TransportTypes
    // ============================================================

    @Test
    @DisplayName("레지스트리 표기와 사용자 표기는 서로 변환된다")
    void transportTypes_mapping() {
        assertThat(TransportTypes.fromRegistry("streamable-http")).isEqualTo("http");
        assertThat(TransportTypes.fromRegistry("stdio")).isEqualTo("stdio");
        assertThat(TransportTypes.fromRegistry("sse")).isEqualTo("sse");
        assertThat(TransportTypes.toRegistry("http")).isEqualTo("streamable-http");
        assertThat(TransportTypes.fromRegistry("websocket")).isEqualTo("websocket");
        assertThat(TransportTypes.toRegistry("websocket")).isEqualTo("websocket");
    }

    @Test
    @DisplayName("전송 타입 필터는 레지스트리 표기를 사용자 표기로 바꿔 비교한다")
    void transportTypeFilter_mapsBeforeMatching() {
        // when
        TransportTypeFilter filter = TransportTypeFilter.parse("http");

        // then
        assertThat(filter.matches("streamable-http")).isTrue();
        assertThat(filter.matches("stdio")).isFalse();
        assertThat(TransportTypeFilter.all().types()).isEqualTo(List.of("stdio", "http", "sse"));
    }

    @Test
    @DisplayName("지원하지 않는 전송 타입은 거부된다")
    void transportTypeFilter_invalid_rejected() {
        assertThatThrownBy(() -> TransportTypeFilter.parse("streamable-http"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("invalid transport type");
        assertThatThrownBy(() -> TransportTypeFilter.parse(""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
