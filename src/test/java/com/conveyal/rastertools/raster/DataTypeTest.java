package com.conveyal.rastertools.raster;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

public class DataTypeTest {

    @Test
    public void testIntegerCastsTruncateAndSaturate () {
        assertEquals(2, DataType.UINT8.cast(2.9));
        assertEquals(0, DataType.UINT8.cast(-3.5));
        assertEquals(255, DataType.UINT8.cast(1000));
        assertEquals(-2, DataType.INT16.cast(-2.9));
        assertEquals(Short.MIN_VALUE, DataType.INT16.cast(-1e9));
        assertEquals(65535, DataType.UINT16.cast(70000.2));
        assertEquals(Integer.MAX_VALUE, DataType.INT32.cast(Double.POSITIVE_INFINITY));
        assertEquals(0, DataType.INT32.cast(Double.NaN));
    }

    @Test
    public void testFloatCasts () {
        assertEquals((double) (float) 0.1, DataType.FLOAT32.cast(0.1));
        assertNotEquals(0.1, DataType.FLOAT32.cast(0.1));
        assertEquals(0.1, DataType.FLOAT64.cast(0.1));
        assertTrue(Double.isNaN(DataType.FLOAT32.cast(Double.NaN)));
        assertTrue(DataType.FLOAT32.isFloatingPoint());
        assertFalse(DataType.INT32.isFloatingPoint());
    }

    @Test
    public void testStorageOfUnsignedTypes () {
        ByteBuffer buffer = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN);
        DataType.UINT8.put(buffer, 250);
        DataType.UINT16.put(buffer, 65000);
        DataType.INT16.put(buffer, -123);
        DataType.FLOAT32.put(buffer, 1.5);
        assertEquals(1 + 2 + 2 + 4, buffer.position());
        buffer.flip();
        assertEquals(250, DataType.UINT8.get(buffer));
        assertEquals(65000, DataType.UINT16.get(buffer));
        assertEquals(-123, DataType.INT16.get(buffer));
        assertEquals(1.5, DataType.FLOAT32.get(buffer));
    }

}
