package com.itinera.pojo.entity;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

/**
 * 餐饮类地点（餐厅、咖啡馆、酒吧等）。
 */
@Getter
@ToString(callSuper = true)
@SuperBuilder
@Jacksonized
public class Establishment extends Place {

    /**
     * 人均价格。
     */
    private final double averagePrice;

    /**
     * 类型，例如 Restaurant / Cafe / Bar。
     */
    private final String establishmentType;

    @Override
    public PlaceKind getKind() {
        return PlaceKind.ESTABLISHMENT;
    }
}
