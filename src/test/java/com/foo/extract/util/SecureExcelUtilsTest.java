package com.foo.extract.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SecureExcelUtilsTest {

  @TempDir Path tempDir;

  // ========== validateFileContent ==========

  @Test
  void validateFileContent_validXlsx_passes() throws IOException {
    Path xlsxFile = createValidXlsxFile("valid.xlsx");
    assertThatCode(() -> SecureExcelUtils.validateFileContent(xlsxFile)).doesNotThrowAnyException();
  }

  @Test
  void validateFileContent_xlsm_passes() throws IOException {
    Path xlsmFile = createValidXlsxFile("macro.xlsm");
    assertThatCode(() -> SecureExcelUtils.validateFileContent(xlsmFile)).doesNotThrowAnyException();
  }

  @ParameterizedTest
  @ValueSource(strings = {"legacy.xls", "data.csv", "data"})
  void validateFileContent_otherExtension_rejected(String name) throws IOException {
    Path file = tempDir.resolve(name);
    Files.write(file, new byte[] {0x50, 0x4B, 0x03, 0x04});

    assertThatThrownBy(() -> SecureExcelUtils.validateFileContent(file))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining(".xlsx");
  }

  @Test
  void validateFileContent_xlsxWithWrongMagicBytes_throwsSecurityException() throws IOException {
    Path fakeXlsx = tempDir.resolve("fake.xlsx");
    Files.write(fakeXlsx, new byte[] {0x25, 0x50, 0x44, 0x46}); // %PDF

    assertThatThrownBy(() -> SecureExcelUtils.validateFileContent(fakeXlsx))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("XLSX");
  }

  @Test
  void validateFileContent_tooSmallFile_throwsIOException() throws IOException {
    Path tinyFile = tempDir.resolve("tiny.xlsx");
    Files.write(tinyFile, new byte[] {0x50});

    assertThatThrownBy(() -> SecureExcelUtils.validateFileContent(tinyFile))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("too small");
  }

  // ========== openWorkbook ==========

  @Test
  void openWorkbook_validXlsxFile_returnsWorkbook() throws IOException {
    Path xlsxFile = createValidXlsxFile("valid.xlsx");

    try (Workbook workbook = SecureExcelUtils.openWorkbook(xlsxFile)) {
      assertThat(workbook.getNumberOfSheets()).isEqualTo(1);
      assertThat(workbook.getSheetAt(0).getRow(0).getCell(0).getStringCellValue()).isEqualTo("Test");
    }
  }

  @Test
  void openWorkbook_zipThatIsNotAWorkbook_throwsIOException() throws IOException {
    Path notExcel = tempDir.resolve("archive.xlsx");
    Files.write(notExcel, new byte[] {0x50, 0x4B, 0x03, 0x04, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00});

    assertThatThrownBy(() -> SecureExcelUtils.openWorkbook(notExcel))
        .isInstanceOf(IOException.class);
  }

  // ========== saveWorkbook ==========

  @Test
  void saveWorkbook_overwritesSourceFile() throws IOException {
    Path file = createValidXlsxFile("inplace.xlsx");

    try (Workbook workbook = SecureExcelUtils.openWorkbook(file)) {
      workbook.getSheetAt(0).getRow(0).getCell(0).setCellValue("Changed");
      SecureExcelUtils.saveWorkbook(workbook, file);
    }

    try (Workbook reopened = SecureExcelUtils.openWorkbook(file)) {
      assertThat(reopened.getSheetAt(0).getRow(0).getCell(0).getStringCellValue()).isEqualTo("Changed");
    }
    try (var files = Files.list(tempDir)) {
      assertThat(files.map(p -> p.getFileName().toString())).containsExactly("inplace.xlsx");
    }
  }

  // ========== helpers ==========

  private Path createValidXlsxFile(String name) throws IOException {
    try (XSSFWorkbook wb = new XSSFWorkbook()) {
      Sheet sheet = wb.createSheet("TestSheet");
      sheet.createRow(0).createCell(0).setCellValue("Test");

      Path file = tempDir.resolve(name);
      try (OutputStream os = Files.newOutputStream(file)) {
        wb.write(os);
      }
      return file;
    }
  }
}
