package com.reactive.notebook.kernel;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.reactive.notebook.api.RichOutput;
import com.reactive.notebook.runtime.Column;
import com.reactive.notebook.runtime.NdArray;
import com.reactive.notebook.runtime.Table;

public class RichOutputProjectorTest {
    private final RichOutputProjector projector = new RichOutputProjector(100, 1000);

    @Test
    public void testTableBecomesDataframe() {
        LinkedHashMap<String, List<Object>> cols = new LinkedHashMap<>();
        cols.put("a", new ArrayList<>(List.of(1L, 2L)));
        cols.put("b", new ArrayList<>(Arrays.asList(1.5, Double.NaN)));
        RichOutput out = projector.project(new Table(cols));

        assertEquals("dataframe", out.getType());
        assertEquals(List.of("a", "b"), out.getColumns());
        assertEquals(Map.of("a", "int64", "b", "float64"), out.getDtypes());
        assertEquals(List.of(2, 2), out.getShape());
        assertEquals(List.of(0, 1), out.getIndex());
        assertFalse(out.isTruncated());

        List<?> records = (List<?>) out.getData();
        assertEquals(Map.of("a", 2L, "b", "NaN"), records.get(1));
    }

    @Test
    public void testDataframeRowCap() {
        List<Object> values = new ArrayList<>();
        for (long i = 0; i < 250; i++)
            values.add(i);
        LinkedHashMap<String, List<Object>> cols = new LinkedHashMap<>();
        cols.put("n", values);
        RichOutput out = projector.project(new Table(cols));

        assertEquals(100, ((List<?>) out.getData()).size());
        assertEquals(List.of(250, 1), out.getShape());
        assertTrue(out.isTruncated());
    }

    @Test
    public void testColumnBecomesSeries() {
        RichOutput out = projector.project(new Column("price", new ArrayList<>(List.of(1.0, 2.5))));
        assertEquals("series", out.getType());
        assertEquals("price", out.getName());
        assertEquals("float64", out.getDtype());
        assertEquals(Map.of("0", 1.0, "1", 2.5), out.getData());
        assertEquals(List.of(2), out.getShape());
    }

    @Test
    public void testTwoDimensionalArrayIsCappedPerAxis() {
        NdArray big = NdArray.zeros(new int[] { 40, 50 });
        RichOutput out = projector.project(big);

        List<?> grid = (List<?>) out.getData();
        assertEquals("ndarray", out.getType());
        assertEquals(31, grid.size());
        assertEquals(31, ((List<?>) grid.get(0)).size());
        assertEquals(List.of(40, 50), out.getShape());
        assertTrue(out.isTruncated());
    }

    @Test
    public void testOneDimensionalArray() {
        RichOutput out = projector.project(new NdArray(new double[] { 1, 2, 3 }, new int[] { 3 }, true));
        assertEquals(List.of(1L, 2L, 3L), out.getData());
        assertEquals("int64", out.getDtype());
        assertFalse(out.isTruncated());
    }

    @Test
    public void testInfinityInArray() {
        RichOutput out = projector.project(new NdArray(new double[] { Double.POSITIVE_INFINITY,
                Double.NEGATIVE_INFINITY }, new int[] { 2 }, false));
        assertEquals(List.of("Infinity", "-Infinity"), out.getData());
    }

    @Test
    public void testPlainValuesHaveNoRichOutput() {
        assertNull(projector.project(42L));
        assertNull(projector.project(List.of(1L)));
    }

    @Test
    public void testDtypeIgnoresNulls() {
        assertEquals("int64", RichOutputProjector.dtype(Arrays.asList(null, 1L)));
        assertEquals("bool", RichOutputProjector.dtype(List.of(true, false)));
        assertEquals("object", RichOutputProjector.dtype(List.of(1L, "x")));
        assertEquals("object", RichOutputProjector.dtype(Arrays.asList((Object) null)));
    }

    @Test
    public void testSafeHandlesCycles() {
        List<Object> loop = new ArrayList<>();
        loop.add(1L);
        loop.add(loop);
        assertEquals(List.of(1L, "[...]"), RichOutputProjector.safe(loop));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCapsMustBePositive() {
        new RichOutputProjector(0, 10);
    }
}
