package com.conveyal.rastertools.raster;

import java.nio.ByteBuffer;

/**
 * Pixel data types supported for reading, processing and writing rasters.
 * Pixel values always travel through the engine as doubles; a DataType describes how they are stored and how a
 * value is converted ("cast") into the type's domain.
 *
 * Casting to an integer type truncates toward zero and saturates at the bounds of the type. NaN casts to zero.
 */
public enum DataType {

    UINT8(1, 0, 255) {
        @Override
        public void put (ByteBuffer buffer, double value) {
            buffer.put((byte) (int) cast(value));
        }

        @Override
        public double get (ByteBuffer buffer) {
            return buffer.get() & 0xFF;
        }
    },

    INT16(2, Short.MIN_VALUE, Short.MAX_VALUE) {
        @Override
        public void put (ByteBuffer buffer, double value) {
            buffer.putShort((short) cast(value));
        }

        @Override
        public double get (ByteBuffer buffer) {
            return buffer.getShort();
        }
    },

    UINT16(2, 0, 65535) {
        @Override
        public void put (ByteBuffer buffer, double value) {
            buffer.putShort((short) (int) cast(value));
        }

        @Override
        public double get (ByteBuffer buffer) {
            return buffer.getShort() & 0xFFFF;
        }
    },

    INT32(4, Integer.MIN_VALUE, Integer.MAX_VALUE) {
        @Override
        public void put (ByteBuffer buffer, double value) {
            buffer.putInt((int) cast(value));
        }

        @Override
        public double get (ByteBuffer buffer) {
            return buffer.getInt();
        }
    },

    FLOAT32(4, -Float.MAX_VALUE, Float.MAX_VALUE) {
        @Override
        public double cast (double value) {
            return (float) value;
        }

        @Override
        public void put (ByteBuffer buffer, double value) {
            buffer.putFloat((float) value);
        }

        @Override
        public double get (ByteBuffer buffer) {
            return buffer.getFloat();
        }
    },

    FLOAT64(8, -Double.MAX_VALUE, Double.MAX_VALUE) {
        @Override
        public double cast (double value) {
            return value;
        }

        @Override
        public void put (ByteBuffer buffer, double value) {
            buffer.putDouble(value);
        }

        @Override
        public double get (ByteBuffer buffer) {
            return buffer.getDouble();
        }
    };

    /** Number of bytes used to store one pixel value. */
    public final int bytes;

    public final double minValue;

    public final double maxValue;

    DataType (int bytes, double minValue, double maxValue) {
        this.bytes = bytes;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    /** Convert a value into the domain of this type. The default implementation is for integer types. */
    public double cast (double value) {
        if (Double.isNaN(value)) return 0;
        double truncated = value < 0 ? Math.ceil(value) : Math.floor(value);
        return Math.max(minValue, Math.min(maxValue, truncated));
    }

    /** Cast the value and write it at the buffer's current position, advancing the position. */
    public abstract void put (ByteBuffer buffer, double value);

    /** Read one value at the buffer's current position, advancing the position. */
    public abstract double get (ByteBuffer buffer);

    public boolean isFloatingPoint () {
        return this == FLOAT32 || this == FLOAT64;
    }

}
