package com.foo.extract.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.util.IOUtils;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Secure utilities for loading and saving Excel workbooks.
 * Checks file content against the XLSX magic bytes before handing it to POI.
 */
public final class SecureExcelUtils {

    // Maximum size for byte array allocation (200 MB)
    private static final int MAX_BYTE_ARRAY_SIZE = 200_000_000;

    // XLSX magic bytes (ZIP format: PK)
    private static final byte[] XLSX_MAGIC = {0x50, 0x4B, 0x03, 0x04};

    static {
        // Configure Apache POI security limits globally
        IOUtils.setByteArrayMaxOverride(MAX_BYTE_ARRAY_SIZE);
    }

    private SecureExcelUtils() {
        // Utility class
    }

    /**
     * Loads a workbook fully into memory after validating its content. The file is not kept
     * open, so the same path can later be overwritten with {@link #saveWorkbook}.
     *
     * @param path the .xlsx/.xlsm file to open
     * @return a Workbook instance
     * @throws IOException if the file cannot be read or is invalid
     * @throws SecurityException if the file fails content validation
     */
    public static Workbook openWorkbook(Path path) throws IOException {
        validateFileContent(path);

        try (InputStream is = Files.newInputStream(path)) {
            return new XSSFWorkbook(is);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to open XLSX file " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the workbook to a temporary sibling file first and then moves it into place, so a
     * failed write never leaves a truncated workbook behind.
     */
    public static void saveWorkbook(Workbook workbook, Path path) throws IOException {
        Path absolute = path.toAbsolutePath();
        Path tmp = Files.createTempFile(absolute.getParent(), ".xlsx-extract-", ".tmp");
        try {
            try (OutputStream os = Files.newOutputStream(tmp)) {
                workbook.write(os);
            }
            Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Validates that a file's content matches its extension.
     * Checks magic bytes to prevent disguised or corrupt files reaching POI.
     *
     * @param path the file to validate
     * @throws IOException if the file cannot be read
     * @throws SecurityException if the file content doesn't match expected format
     */
    public static void validateFileContent(Path path) throws IOException {
        String fileName = path.getFileName().toString().toLowerCase();

        if (!fileName.endsWith(".xlsx") && !fileName.endsWith(".xlsm")) {
            throw new SecurityException("Only .xlsx and .xlsm files are supported: " + path.getFileName());
        }

        byte[] header = readFileHeader(path, 8);
        if (!matchesMagicBytes(header, XLSX_MAGIC)) {
            throw new SecurityException(
                "File content does not match XLSX format. " +
                "The file may be corrupted or disguised.");
        }
    }

    private static byte[] readFileHeader(Path path, int length) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            byte[] header = new byte[length];
            int bytesRead = is.read(header);
            if (bytesRead < 4) {
                throw new IOException("File is too small to be a valid Excel file");
            }
            return header;
        }
    }

    private static boolean matchesMagicBytes(byte[] header, byte[] magic) {
        if (header.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (header[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
