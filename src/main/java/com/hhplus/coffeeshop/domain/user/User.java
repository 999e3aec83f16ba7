package com.hhplus.coffeeshop.domain.user;

import com.hhplus.coffeeshop.domain.loyalty.LoyaltyAccount;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * User 엔티티
 *
 * 주문 엔진에서는 식별자와 포인트 계정(LoyaltyAccount)만 사용합니다.
 * 인증 정보는 외부 인증 계층이 관리합니다.
 */
@Entity
@Table(name = "users")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Column(name = "name")
    private String name;

    @Column(name = "phone")
    private String phone;

    @Embedded
    @Builder.Default
    private LoyaltyAccount loyalty = LoyaltyAccount.empty();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static User createUser(String email, String name, String phone) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("이메일은 필수입니다");
        }
        LocalDateTime now = LocalDateTime.now();
        return User.builder()
                .email(email)
                .name(name)
                .phone(phone)
                .loyalty(LoyaltyAccount.empty())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
