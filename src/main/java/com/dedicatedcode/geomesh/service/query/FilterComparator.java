/*
 *  This file is part of geomesh.
 *
 *  Geomesh is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Geomesh is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Geomesh. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.geomesh.service.query;

import com.dedicatedcode.geomesh.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.List;

public enum FilterComparator {
    GREATER_THAN(">", "greater_than"),
    GREATER_THAN_OR_EQUAL(">=", "greater_than_or_equal"),
    LESSER_THAN("<", "lesser_than"),
    LESSER_THAN_OR_EQUAL("<=", "lesser_than_or_equal"),
    EQUAL_TO("=", "equal_to");

    private final String symbol;
    private final String longForm;

    FilterComparator(String symbol, String longForm) {
        this.symbol = symbol;
        this.longForm = longForm;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean test(double value, double target) {
        switch (this) {
            case GREATER_THAN:
                return value > target;
            case GREATER_THAN_OR_EQUAL:
                return value >= target;
            case LESSER_THAN:
                return value < target;
            case LESSER_THAN_OR_EQUAL:
                return value <= target;
            case EQUAL_TO:
            default:
                return value == target;
        }
    }

    public static FilterComparator parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase();
            for (FilterComparator comparator : values()) {
                if (comparator.symbol.equals(normalized) || comparator.longForm.equals(normalized)) {
                    return comparator;
                }
            }
        }
        List<String> known = Arrays.stream(values()).map(c -> c.symbol).toList();
        throw new InvalidArgumentException("Unknown comparator " + value + ", valid comparators are " + known);
    }
}
