/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.spharm.io;

import com.github.tinemuz.spharm.Kind;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Arrays;

import org.apache.commons.math3.complex.Complex;

/**
 * Binary array files: the magic number {@code SPHA}, a version byte, an
 * element-kind byte (0 real, 1 complex), the rank and dimensions as ints,
 * then the values in row-major order as big-endian doubles (complex values
 * as real and imaginary pairs).
 */
public final class BinaryArrays {
    static final int MAGIC = 0x53504841;
    static final byte VERSION = 1;
    private static final int MAX_RANK = 8;

    private BinaryArrays() {}

    /** Array contents read from or written to a file. Complex values are interleaved. */
    public record Block(Kind kind, int[] shape, double[] values) {
        public int rank() {
            return shape.length;
        }
    }

    public static void write(Path path, Block block) throws IOException {
        try (OutputStream raw = Compression.create(path);
                DataOutputStream out = new DataOutputStream(raw)) {
            out.writeInt(MAGIC);
            out.writeByte(VERSION);
            out.writeByte(block.kind() == Kind.COMPLEX ? 1 : 0);
            out.writeInt(block.rank());
            for (int d : block.shape()) out.writeInt(d);
            for (double v : block.values()) out.writeDouble(v);
        }
    }

    public static Block read(Path path) throws IOException {
        try (InputStream raw = Compression.open(path);
                DataInputStream in = new DataInputStream(raw)) {
            if (in.readInt() != MAGIC) {
                throw new IOException(path + " is not a binary array file");
            }
            byte version = in.readByte();
            if (version != VERSION) {
                throw new IOException("Unsupported binary array version " + version + " in " + path);
            }
            Kind kind = in.readByte() == 1 ? Kind.COMPLEX : Kind.REAL;
            int rank = in.readInt();
            if (rank < 1 || rank > MAX_RANK) {
                throw new IOException("Invalid array rank " + rank + " in " + path);
            }
            int[] shape = new int[rank];
            long count = kind == Kind.COMPLEX ? 2 : 1;
            for (int i = 0; i < rank; i++) {
                shape[i] = in.readInt();
                if (shape[i] < 0) throw new IOException("Negative dimension in " + path);
                count *= shape[i];
            }
            if (count > Integer.MAX_VALUE) throw new IOException("Array too large in " + path);
            double[] values = new double[(int) count];
            for (int i = 0; i < values.length; i++) values[i] = in.readDouble();
            return new Block(kind, shape, values);
        }
    }

    static Block of(double[][][] a) {
        int n0 = a.length;
        int n1 = a[0].length;
        int n2 = a[0][0].length;
        double[] v = new double[n0 * n1 * n2];
        int k = 0;
        for (double[][] plane : a) {
            for (double[] row : plane) {
                System.arraycopy(row, 0, v, k, n2);
                k += n2;
            }
        }
        return new Block(Kind.REAL, new int[] {n0, n1, n2}, v);
    }

    static Block of(Complex[][][] a) {
        int n0 = a.length;
        int n1 = a[0].length;
        int n2 = a[0][0].length;
        double[] v = new double[2 * n0 * n1 * n2];
        int k = 0;
        for (Complex[][] plane : a) {
            for (Complex[] row : plane) {
                for (Complex c : row) {
                    v[k++] = c.getReal();
                    v[k++] = c.getImaginary();
                }
            }
        }
        return new Block(Kind.COMPLEX, new int[] {n0, n1, n2}, v);
    }

    static Block of(double[][] a) {
        int nlon = a[0].length;
        double[] v = new double[a.length * nlon];
        for (int i = 0; i < a.length; i++) System.arraycopy(a[i], 0, v, i * nlon, nlon);
        return new Block(Kind.REAL, new int[] {a.length, nlon}, v);
    }

    static Block of(Complex[][] a) {
        int nlon = a[0].length;
        double[] v = new double[2 * a.length * nlon];
        int k = 0;
        for (Complex[] row : a) {
            for (Complex c : row) {
                v[k++] = c.getReal();
                v[k++] = c.getImaginary();
            }
        }
        return new Block(Kind.COMPLEX, new int[] {a.length, nlon}, v);
    }

    static double[][][] toReal3(Block b) {
        int[] s = b.shape();
        double[][][] out = new double[s[0]][s[1]][s[2]];
        int k = 0;
        for (int i = 0; i < s[0]; i++) {
            for (int j = 0; j < s[1]; j++) {
                System.arraycopy(b.values(), k, out[i][j], 0, s[2]);
                k += s[2];
            }
        }
        return out;
    }

    static Complex[][][] toComplex3(Block b) {
        int[] s = b.shape();
        Complex[][][] out = new Complex[s[0]][s[1]][s[2]];
        int k = 0;
        for (int i = 0; i < s[0]; i++) {
            for (int j = 0; j < s[1]; j++) {
                for (int m = 0; m < s[2]; m++) {
                    out[i][j][m] = new Complex(b.values()[k], b.values()[k + 1]);
                    k += 2;
                }
            }
        }
        return out;
    }

    static double[][] toReal2(Block b) {
        int[] s = b.shape();
        double[][] out = new double[s[0]][];
        for (int i = 0; i < s[0]; i++) {
            out[i] = Arrays.copyOfRange(b.values(), i * s[1], (i + 1) * s[1]);
        }
        return out;
    }

    static Complex[][] toComplex2(Block b) {
        int[] s = b.shape();
        Complex[][] out = new Complex[s[0]][s[1]];
        int k = 0;
        for (int i = 0; i < s[0]; i++) {
            for (int j = 0; j < s[1]; j++) {
                out[i][j] = new Complex(b.values()[k], b.values()[k + 1]);
                k += 2;
            }
        }
        return out;
    }
}
