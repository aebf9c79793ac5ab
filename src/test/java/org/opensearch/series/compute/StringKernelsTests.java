/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.series.compute;

import org.opensearch.series.common.SeriesEngineConfig;
import org.opensearch.series.common.StringLengthUnit;
import org.opensearch.series.common.exception.SeriesConfigurationException;
import org.opensearch.series.common.exception.SeriesTypeException;
import org.opensearch.series.core.Series;
import org.opensearch.series.core.model.Dtype;
import org.opensearch.test.OpenSearchTestCase;

import java.util.Arrays;

public class StringKernelsTests extends OpenSearchTestCase {

    public void testLengthsInBytesByDefault() {
        Series lengths = Series.ofStrings("s", "abc", "héllo", null, "").strLengths();

        assertEquals(Dtype.INT64, lengths.dtype());
        assertEquals(Arrays.asList(3L, 6L, null, 0L), lengths.toList());
    }

    public void testLengthsInCodePoints() {
        SeriesEngineConfig config = new SeriesEngineConfig(false, StringLengthUnit.CHARS, "strict_date", "epoch_millis");
        Series lengths = StringKernels.lengths(Series.ofStrings("s", "héllo", "😀"), config);

        assertEquals(Arrays.asList(5L, 1L), lengths.toList());
    }

    public void testContains() {
        Series matches = Series.ofStrings("s", "apple", "banana", null).strContains("an+a$");

        assertEquals(Dtype.BOOLEAN, matches.dtype());
        assertEquals(Arrays.asList(false, true, null), matches.toList());
    }

    public void testReplaceIsLiteral() {
        Series series = Series.ofStrings("s", "a-b-c", null);

        assertEquals(Arrays.asList("a$1b-c", null), series.strReplace("-", "$1").toList());
        assertEquals(Arrays.asList("a+b+c", null), series.strReplaceAll("[-]", "+").toList());
    }

    public void testCaseConversion() {
        Series series = Series.ofStrings("s", "MiXeD", "title", null);

        assertEquals(Arrays.asList("MIXED", "TITLE", null), series.toUppercase().toList());
        assertEquals(Arrays.asList("mixed", "title", null), series.toLowercase().toList());
    }

    public void testParseDatesWithExplicitFormat() {
        Series series = Series.ofStrings("s", "01/02/2020", "2020-01-02", null);

        assertEquals(Arrays.asList(18263, null, null), series.strParseDate32("MM/dd/uuuu").toList());
        assertEquals(Arrays.asList(1577923200000L, null, null), series.strParseDate64("MM/dd/uuuu").toList());
    }

    public void testParseDatesWithDefaultFormat() {
        Series series = Series.ofStrings("s", "2020-01-02T12:00:00Z", "yesterday");

        assertEquals(Arrays.asList(18263, null), series.strParseDate32(null).toList());
        assertEquals(Arrays.asList(1577966400000L, null), series.strParseDate64(null).toList());
    }

    public void testInvalidPatterns() {
        Series series = Series.ofStrings("s", "a");

        expectThrows(SeriesConfigurationException.class, () -> series.strContains("(unclosed"));
        expectThrows(SeriesConfigurationException.class, () -> series.strReplaceAll("[", "x"));
        expectThrows(SeriesConfigurationException.class, () -> series.strParseDate32("not_a_named_format_qq"));
    }

    public void testRequiresStrings() {
        Series numbers = Series.ofLongs("n", 1L);

        expectThrows(SeriesTypeException.class, numbers::strLengths);
        expectThrows(SeriesTypeException.class, () -> numbers.strContains("1"));
        expectThrows(SeriesTypeException.class, numbers::toUppercase);
        expectThrows(SeriesTypeException.class, () -> numbers.strParseDate64(null));
    }
}
