package com.hhplus.coffeeshop.domain.order;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Random;

/**
 * 주문번호 생성기
 *
 * 형식: ORD-yyyyMMdd-XXXXXX (영문 대문자 + 숫자 6자리)
 * 유일성은 저장 직전 존재 여부 확인과 DB 유니크 제약으로 보장합니다.
 */
public class OrderNumberGenerator {

    private static final String PREFIX = "ORD-";
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int SUFFIX_LENGTH = 6;
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Random random;

    public OrderNumberGenerator(Random random) {
        this.random = random;
    }

    public String generate(LocalDate date) {
        StringBuilder sb = new StringBuilder(PREFIX)
                .append(date.format(DATE_FORMAT))
                .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
