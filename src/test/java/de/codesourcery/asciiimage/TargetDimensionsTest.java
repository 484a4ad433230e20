/**
 * Copyright 2015 Tobias Gierke <tobias.gierke@code-sourcery.de>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.codesourcery.asciiimage;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Tests for resolving and fitting output dimensions.
public class TargetDimensionsTest {

    @Test
    void testDefaultsWithoutEnvironment() {
        assertThat(TargetDimensions.fromEnvironment(Map.of()))
            .isEqualTo(new TargetDimensions(TargetDimensions.DEFAULT_COLUMNS, TargetDimensions.DEFAULT_ROWS));
    }

    @Test
    void testTerminalSizeFromEnvironment() {
        TargetDimensions size = TargetDimensions.fromEnvironment(Map.of("COLUMNS", "120", "LINES", " 40 "));

        assertThat(size.columns).isEqualTo(120);
        assertThat(size.rows).isEqualTo(40);
    }

    @Test
    void testInvalidEnvironmentValuesFallBackToDefaults() {
        TargetDimensions size = TargetDimensions.fromEnvironment(Map.of("COLUMNS", "wide", "LINES", "-3"));

        assertThat(size).isEqualTo(new TargetDimensions(80, 24));
    }

    @Test
    void testFitShrinksKeepingAspectRatio() {
        TargetDimensions box = new TargetDimensions(80, 24);

        assertThat(box.fit(160, 96, 0.5)).isEqualTo(new TargetDimensions(80, 24));
        assertThat(box.fit(320, 96, 0.5)).isEqualTo(new TargetDimensions(80, 12));
        assertThat(box.fit(80, 192, 0.5)).isEqualTo(new TargetDimensions(20, 24));
    }

    @Test
    void testFitDoesNotEnlarge() {
        assertThat(new TargetDimensions(80, 24).fit(10, 10, 0.5)).isEqualTo(new TargetDimensions(10, 5));
    }

    @Test
    void testFitKeepsAtLeastOneCell() {
        assertThat(new TargetDimensions(80, 24).fit(1000, 1, 0.5)).isEqualTo(new TargetDimensions(80, 1));
    }

    @Test
    void testFitOfDegenerateSizes() {
        assertThat(new TargetDimensions(80, 24).fit(0, 0, 0.5)).isEqualTo(new TargetDimensions(0, 0));
        assertThat(new TargetDimensions(0, 24).fit(10, 10, 0.5)).isEqualTo(new TargetDimensions(0, 0));
    }

    @Test
    void testRowsAndColumnsFor() {
        assertThat(TargetDimensions.rowsFor(80, 200, 100, 0.5)).isEqualTo(20);
        assertThat(TargetDimensions.columnsFor(20, 200, 100, 0.5)).isEqualTo(80);
        assertThat(TargetDimensions.rowsFor(0, 200, 100, 0.5)).isZero();
        assertThat(TargetDimensions.rowsFor(10, 1000, 1, 0.5)).isEqualTo(1);
    }

    @Test
    void testRowsAndColumnsForLargeImages() {
        assertThat(TargetDimensions.columnsFor(100_000, 100_000, 100_000, 1.0)).isEqualTo(100_000);
        assertThat(TargetDimensions.rowsFor(100_000, 100_000, 100_000, 1.0)).isEqualTo(100_000);
        assertThatThrownBy(() -> TargetDimensions.columnsFor(Integer.MAX_VALUE, Integer.MAX_VALUE, 1, 1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testInvalidArguments() {
        assertThatThrownBy(() -> new TargetDimensions(-1, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TargetDimensions(2, 2).fit(2, 2, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
