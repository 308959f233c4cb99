package com.example.availability.service;

import com.example.availability.model.Court;

import java.math.BigDecimal;

public interface PricingService {

    /**
     * Price of booking {@code court} for {@code [startIso, endIso)}.
     *
     * @throws com.example.availability.service.exception.InvalidTimeInputException when the times are unusable
     * @throws com.example.availability.service.exception.PricingException when no price can be computed
     */
    BigDecimal calculatePrice(Court court, String startIso, String endIso, String userId);
}
