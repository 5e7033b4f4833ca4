package com.itinera.pojo.entity;

import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

@ToString(callSuper = true)
@SuperBuilder
@Jacksonized
public class Landmark extends Place {

    @Override
    public PlaceKind getKind() {
        return PlaceKind.LANDMARK;
    }
}
