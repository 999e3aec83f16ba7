package com.hhplus.coffeeshop.domain.common;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 토핑 ID 집합 ↔ 컬럼 문자열 변환기
 *
 * 정렬된 쉼표 구분 문자열("3,7,12")로 저장하므로 같은 집합은 항상 같은 컬럼 값을 가집니다.
 * 도메인 모델은 Set 동등성으로 비교하고, 직렬화 형식은 저장 계층의 세부 사항입니다.
 */
@Converter
public class ToppingIdsConverter implements AttributeConverter<Set<Long>, String> {

    private static final String DELIMITER = ",";

    @Override
    public String convertToDatabaseColumn(Set<Long> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return "";
        }
        return new TreeSet<>(attribute).stream()
                .map(String::valueOf)
                .collect(Collectors.joining(DELIMITER));
    }

    @Override
    public Set<Long> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new TreeSet<>();
        }
        return Arrays.stream(dbData.split(DELIMITER))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Long::valueOf)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
