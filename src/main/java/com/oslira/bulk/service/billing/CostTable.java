package com.oslira.bulk.service.billing;

import com.oslira.bulk.model.ComplexityClass;
import com.oslira.bulk.model.ItemCost;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Credits and actual cost per successful item, by complexity class.
 */
public final class CostTable {

    private final Map<ComplexityClass, ItemCost> costs;

    public CostTable(Map<ComplexityClass, ItemCost> costs) {
        this.costs = new EnumMap<>(costs);
    }

    /**
     * light=1, deep=2, xray=3 credits; 0.003 USD vendor cost each.
     */
    public static CostTable defaults() {
        BigDecimal scrapingCost = new BigDecimal("0.003");
        return new CostTable(Map.of(
                ComplexityClass.LIGHT, new ItemCost(1, scrapingCost),
                ComplexityClass.DEEP, new ItemCost(2, scrapingCost),
                ComplexityClass.XRAY, new ItemCost(3, scrapingCost)
        ));
    }

    /**
     * @throws IllegalArgumentException if no price is configured for the class
     */
    public ItemCost costFor(ComplexityClass complexity) {
        ItemCost cost = costs.get(complexity);
        if (cost == null) {
            throw new IllegalArgumentException("No cost configured for complexity class " + complexity);
        }
        return cost;
    }

    public int creditsFor(ComplexityClass complexity, int itemCount) {
        return costFor(complexity).creditsPerItem() * itemCount;
    }
}
