package com.ryuqq.packsync.core.version;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic Version (SemVer 2.0.0 우선순위 규칙).
 *
 * <p><strong>허용 형식 (느슨한 파싱):</strong></p>
 * <ul>
 *   <li>선택적 접두사 "v" (예: v1.2.3)</li>
 *   <li>1~3개의 숫자 구성 요소 (누락된 구성 요소는 0, 예: "1.2" = 1.2.0)</li>
 *   <li>선택적 prerelease (예: 1.0.0-beta.1)</li>
 *   <li>선택적 build metadata (예: 1.0.0+20240101, 비교 시 무시)</li>
 * </ul>
 *
 * <p><strong>비교 규칙:</strong></p>
 * <ol>
 *   <li>major → minor → patch 숫자 비교</li>
 *   <li>prerelease가 있는 버전은 없는 버전보다 낮음</li>
 *   <li>prerelease 식별자: 숫자는 숫자로, 문자는 사전순, 숫자 &lt; 문자</li>
 *   <li>식별자가 모두 같으면 개수가 많은 쪽이 높음</li>
 * </ol>
 *
 * @param major major 버전
 * @param minor minor 버전
 * @param patch patch 버전
 * @param preRelease prerelease 식별자 목록 (없으면 빈 리스트)
 * @param build build metadata (없으면 빈 문자열)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SemanticVersion(
    long major,
    long minor,
    long patch,
    List<String> preRelease,
    String build
) implements Comparable<SemanticVersion> {

    private static final Pattern VERSION_PATTERN = Pattern.compile(
        "^v?(0|[1-9]\\d*)(?:\\.(0|[1-9]\\d*))?(?:\\.(0|[1-9]\\d*))?"
            + "(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?"
            + "(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?$"
    );

    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 음수 구성 요소가 있는 경우
     */
    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version components cannot be negative");
        }
        preRelease = preRelease == null ? List.of() : List.copyOf(preRelease);
        build = build == null ? "" : build;
    }

    /**
     * 버전 문자열 파싱.
     *
     * @param value 버전 문자열
     * @return SemanticVersion 인스턴스
     * @throws IllegalArgumentException semver 형식이 아닌 경우
     */
    public static SemanticVersion parse(String value) {
        return tryParse(value).orElseThrow(
            () -> new IllegalArgumentException("Invalid semantic version: " + value)
        );
    }

    /**
     * 버전 문자열 파싱 (실패 시 empty).
     *
     * @param value 버전 문자열 (null 가능)
     * @return 파싱된 버전, semver 형식이 아니면 empty
     */
    public static Optional<SemanticVersion> tryParse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Matcher m = VERSION_PATTERN.matcher(value.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            long major = Long.parseLong(m.group(1));
            long minor = m.group(2) == null ? 0 : Long.parseLong(m.group(2));
            long patch = m.group(3) == null ? 0 : Long.parseLong(m.group(3));
            List<String> preRelease = m.group(4) == null
                ? List.of()
                : List.of(m.group(4).split("\\."));
            return Optional.of(new SemanticVersion(major, minor, patch, preRelease, m.group(5)));
        } catch (NumberFormatException e) {
            // long 범위를 넘는 숫자
            return Optional.empty();
        }
    }

    /**
     * prerelease 버전인지 확인.
     *
     * @return prerelease 식별자가 있으면 true
     */
    public boolean isPreRelease() {
        return !preRelease.isEmpty();
    }

    /**
     * 다른 버전보다 높은지 확인.
     *
     * @param other 비교 대상
     * @return this &gt; other
     */
    public boolean isGreaterThan(SemanticVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int result = Long.compare(major, other.major);
        if (result != 0) {
            return result;
        }
        result = Long.compare(minor, other.minor);
        if (result != 0) {
            return result;
        }
        result = Long.compare(patch, other.patch);
        if (result != 0) {
            return result;
        }
        return comparePreRelease(preRelease, other.preRelease);
    }

    private static int comparePreRelease(List<String> left, List<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            // release > prerelease
            return Boolean.compare(left.isEmpty(), right.isEmpty());
        }
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            int result = compareIdentifier(left.get(i), right.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareIdentifier(String left, String right) {
        boolean leftNumeric = NUMERIC.matcher(left).matches();
        boolean rightNumeric = NUMERIC.matcher(right).matches();
        if (leftNumeric && rightNumeric) {
            int lengthCompare = Integer.compare(stripLeadingZeros(left).length(), stripLeadingZeros(right).length());
            return lengthCompare != 0 ? lengthCompare : stripLeadingZeros(left).compareTo(stripLeadingZeros(right));
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return left.compareTo(right);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
            .append(major).append('.').append(minor).append('.').append(patch);
        if (!preRelease.isEmpty()) {
            sb.append('-').append(String.join(".", preRelease));
        }
        if (!build.isEmpty()) {
            sb.append('+').append(build);
        }
        return sb.toString();
    }
}
