package com.jpyq.ast;

import java.math.BigInteger;

/**
 * Value of a {@link PyNode.Constant}.
 */
public sealed interface Literal {

    /** The value as a plain Java object, {@code null} for {@code None}. For tests and interop. */
    Object javaValue();

    record IntLiteral(BigInteger value) implements Literal {
        private static final int LONG_BITS = 63;

        @Override
        public Object javaValue() {
            return value.bitLength() <= LONG_BITS ? (Object) value.longValue() : value;
        }
    }

    record FloatLiteral(double value) implements Literal {
        @Override
        public Object javaValue() {
            return value;
        }
    }

    /** Imaginary part of a complex literal such as {@code 2j}. */
    record ImaginaryLiteral(double value) implements Literal {
        @Override
        public Object javaValue() {
            return value;
        }
    }

    /** {@code unicodePrefix} records a {@code u'...'} spelling, CPython's {@code kind='u'}. */
    record StringLiteral(String value, boolean unicodePrefix) implements Literal {
        public StringLiteral(String value) {
            this(value, false);
        }

        @Override
        public Object javaValue() {
            return value;
        }
    }

    /** Bytes are held one per char, each in the range 0-255. */
    record BytesLiteral(String value) implements Literal {
        @Override
        public Object javaValue() {
            byte[] bytes = new byte[value.length()];
            for (int i = 0; i < bytes.length; i++) {
                bytes[i] = (byte) value.charAt(i);
            }
            return bytes;
        }
    }

    record BoolLiteral(boolean value) implements Literal {
        @Override
        public Object javaValue() {
            return value;
        }
    }

    record NoneLiteral() implements Literal {
        @Override
        public Object javaValue() {
            return null;
        }
    }

    record EllipsisLiteral() implements Literal {
        @Override
        public Object javaValue() {
            return "...";
        }
    }

    static Literal of(long value) {
        return new IntLiteral(BigInteger.valueOf(value));
    }

    static Literal of(double value) {
        return new FloatLiteral(value);
    }

    static Literal of(String value) {
        return new StringLiteral(value);
    }

    static Literal of(boolean value) {
        return new BoolLiteral(value);
    }
}
