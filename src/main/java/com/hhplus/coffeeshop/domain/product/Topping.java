package com.hhplus.coffeeshop.domain.product;

import jakarta.persistence.*;
import lombok.*;

/**
 * Topping 엔티티 (읽기 전용 카탈로그)
 */
@Entity
@Table(name = "toppings")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Topping {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "topping_id")
    private Long toppingId;

    @Column(name = "topping_name", nullable = false)
    private String toppingName;

    @Column(name = "price", nullable = false)
    private Long price;

    @Column(name = "is_available", nullable = false)
    @Builder.Default
    private Boolean isAvailable = true;
}
