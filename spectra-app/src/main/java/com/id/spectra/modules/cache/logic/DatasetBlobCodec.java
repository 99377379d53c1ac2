package com.id.spectra.modules.cache.logic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.spectra.model.DatasetMetadata;
import com.id.spectra.model.SpectralDataset;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Binary form of a {@link SpectralDataset}. Doubles are stored as their raw IEEE-754 bits so a
 * decoded dataset matches the encoded one bit for bit, NaN payloads included.
 * <pre>
 * int magic, int version,
 * int metadataLength, byte[] metadata (JSON),
 * int W, double[W] wavelength, int T, double[T] timeHours,
 * double[W][T] fluxRaw, double[W][T] fluxNormalized, double[W][T] errorRaw
 * </pre>
 */
public class DatasetBlobCodec {

    private static final int MAGIC = 0x53504453;
    private static final int VERSION = 1;
    private static final int BUFFER_SIZE = 64 * 1024;

    private final ObjectMapper objectMapper;

    public DatasetBlobCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(SpectralDataset dataset, OutputStream target) throws IOException {
        DataOutputStream out = new DataOutputStream(new BufferedOutputStream(target, BUFFER_SIZE));
        out.writeInt(MAGIC);
        out.writeInt(VERSION);
        byte[] metadata = objectMapper.writeValueAsBytes(dataset.getMetadata());
        out.writeInt(metadata.length);
        out.write(metadata);
        writeVector(out, dataset.getCommonWavelength());
        writeVector(out, dataset.getTimeHours());
        writeMatrix(out, dataset.getFluxRaw());
        writeMatrix(out, dataset.getFluxNormalized());
        writeMatrix(out, dataset.getErrorRaw());
        out.flush();
    }

    public SpectralDataset read(InputStream source) throws IOException {
        DataInputStream in = new DataInputStream(new BufferedInputStream(source, BUFFER_SIZE));
        if (in.readInt() != MAGIC) {
            throw new IOException("Not a dataset blob");
        }
        int version = in.readInt();
        if (version != VERSION) {
            throw new IOException("Unsupported dataset blob version " + version);
        }
        byte[] metadata = new byte[in.readInt()];
        in.readFully(metadata);
        double[] wavelength = readVector(in);
        double[] time = readVector(in);
        return SpectralDataset.builder()
                .metadata(objectMapper.readValue(metadata, DatasetMetadata.class))
                .commonWavelength(wavelength)
                .timeHours(time)
                .fluxRaw(readMatrix(in, wavelength.length, time.length))
                .fluxNormalized(readMatrix(in, wavelength.length, time.length))
                .errorRaw(readMatrix(in, wavelength.length, time.length))
                .build();
    }

    private static void writeVector(DataOutputStream out, double[] values) throws IOException {
        out.writeInt(values.length);
        for (double v : values) {
            out.writeLong(Double.doubleToRawLongBits(v));
        }
    }

    private static void writeMatrix(DataOutputStream out, double[][] matrix) throws IOException {
        for (double[] row : matrix) {
            for (double v : row) {
                out.writeLong(Double.doubleToRawLongBits(v));
            }
        }
    }

    private static double[] readVector(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length < 0) {
            throw new IOException("Negative vector length " + length);
        }
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = Double.longBitsToDouble(in.readLong());
        }
        return values;
    }

    private static double[][] readMatrix(DataInputStream in, int rows, int columns) throws IOException {
        double[][] matrix = new double[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                matrix[r][c] = Double.longBitsToDouble(in.readLong());
            }
        }
        return matrix;
    }
}
