package com.hhplus.coffeeshop.application.order.dto;

import com.hhplus.coffeeshop.domain.cart.Temperature;
import com.hhplus.coffeeshop.domain.order.OrderLine;
import com.hhplus.coffeeshop.domain.product.CupSize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineView {
    private Long orderLineId;
    private Long productId;
    private String productName;
    private CupSize size;
    private Integer quantity;
    private Long unitPrice;
    private Integer sugarLevel;
    private Integer iceLevel;
    private Temperature temperature;
    private List<Long> toppingIds;
    private Long toppingCost;
    private Long lineSubtotal;

    public static OrderLineView from(OrderLine line) {
        return OrderLineView.builder()
                .orderLineId(line.getOrderLineId())
                .productId(line.getProductId())
                .productName(line.getProductName())
                .size(line.getSize())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .sugarLevel(line.getSugarLevel())
                .iceLevel(line.getIceLevel())
                .temperature(line.getTemperature())
                .toppingIds(new ArrayList<>(line.getToppingIds()))
                .toppingCost(line.getToppingCost())
                .lineSubtotal(line.getLineSubtotal())
                .build();
    }
}
