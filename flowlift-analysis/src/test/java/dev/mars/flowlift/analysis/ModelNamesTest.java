/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowlift.analysis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ModelNamesTest {

    private final ModelNames names = new ModelNames();

    @ParameterizedTest
    @CsvSource({
            "Customer Orders, customer_orders",
            "dbo.Orders, dbo_orders",
            "__Sales -- 2024__, sales_2024",
            "Café Totals, caf_totals",
            "'%%%', unknown",
            "'', unknown"
    })
    void sanitizes(String input, String expected) {
        assertEquals(expected, names.sanitize(input));
    }

    @Test
    void nullIsUnknown() {
        assertEquals(ModelNames.FALLBACK, names.sanitize(null));
    }

    @Test
    void truncatesToMaximumLength() {
        String sanitized = names.sanitize("a".repeat(80));

        assertThat(sanitized).hasSize(ModelNames.DEFAULT_MAX_LENGTH);
    }

    @Test
    void truncationDoesNotLeaveTrailingUnderscore() {
        ModelNames short5 = new ModelNames(5);

        assertEquals(5, short5.getMaxLength());
        assertEquals(ModelNames.DEFAULT_MAX_LENGTH, names.getMaxLength());
        assertEquals("abcd", short5.sanitize("abcd efgh"));
    }

    @Test
    void rejectsNonPositiveLength() {
        assertThatThrownBy(() -> new ModelNames(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
