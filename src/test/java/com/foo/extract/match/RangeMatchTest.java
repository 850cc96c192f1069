package com.foo.extract.match;

import com.foo.extract.TestWorkbooks;
import com.foo.extract.range.Alias;
import com.foo.extract.range.Range;
import java.util.Optional;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RangeMatchTest {

    private static final ValueComparator REPORT_1 = ValueComparator.equalTo("Report 1");

    private XSSFWorkbook workbook;

    @BeforeEach
    void setUp() {
        workbook = TestWorkbooks.source();
    }

    @AfterEach
    void tearDown() throws Exception {
        workbook.close();
    }

    private String found(RangeMatch match) {
        return match.match(workbook).map(r -> r.range().getReference(false, true, false)).orElse(null);
    }

    private static CellMatch valueCell(Object value) {
        return CellMatch.byValue("cell", null, ValueComparator.equalTo(value));
    }

    @Nested
    class Construction {

        @Test
        void referenceAndStart_throws() {
            assertThatThrownBy(() -> RangeMatch.builder()
                    .name("r").reference("B5:F9").startCell(valueCell("Jan")).build())
                    .isInstanceOf(ExtractConfigurationException.class)
                    .hasMessage("r: Exactly one of reference and start cell must be set");
        }

        @Test
        void neitherReferenceNorStart_throws() {
            assertThatThrownBy(() -> RangeMatch.builder().name("r").build())
                    .isInstanceOf(ExtractConfigurationException.class);
        }

        @Test
        void referenceWithSize_throws() {
            assertThatThrownBy(() -> RangeMatch.builder().name("r").reference("B5").rows(2).cols(2).build())
                    .isInstanceOf(ExtractConfigurationException.class);
            assertThatThrownBy(() -> RangeMatch.builder().name("r").reference("B5").endCell(valueCell("x")).build())
                    .isInstanceOf(ExtractConfigurationException.class);
        }

        @Test
        void rowsWithoutCols_throws() {
            assertThatThrownBy(() -> RangeMatch.builder().name("r").startCell(valueCell("Jan")).rows(2).build())
                    .isInstanceOf(ExtractConfigurationException.class)
                    .hasMessageContaining("together");
        }

        @Test
        void endCellAndSize_throws() {
            assertThatThrownBy(() -> RangeMatch.builder()
                    .name("r").startCell(valueCell("Jan")).endCell(valueCell("Apr")).rows(1).cols(4).build())
                    .isInstanceOf(ExtractConfigurationException.class);
        }

        @Test
        void zeroSize_throws() {
            assertThatThrownBy(() -> RangeMatch.builder().name("r").startCell(valueCell("Jan")).rows(0).cols(2).build())
                    .isInstanceOf(ExtractConfigurationException.class);
        }

        @Test
        void sheetFilter_isPropagatedToCells() {
            ValueComparator other = ValueComparator.equalTo("Report 2");
            RangeMatch match = RangeMatch.builder()
                    .name("r")
                    .sheet(REPORT_1)
                    .startCell(valueCell("Jan"))
                    .endCell(CellMatch.byValue("end", other, ValueComparator.equalTo("Q2")))
                    .build();

            assertThat(match.startCell().sheet()).isEqualTo(REPORT_1);
            assertThat(match.endCell().sheet()).isEqualTo(other);
        }

        @Test
        void sizeMode_followsSettings() {
            assertThat(RangeMatch.byReference("r", "B5").sizeMode()).isEqualTo(RangeMatch.SizeMode.REFERENCE);
            assertThat(RangeMatch.builder().startCell(valueCell("a")).endCell(valueCell("b")).build().sizeMode())
                    .isEqualTo(RangeMatch.SizeMode.END_CELL);
            assertThat(RangeMatch.builder().startCell(valueCell("a")).rows(1).cols(1).build().sizeMode())
                    .isEqualTo(RangeMatch.SizeMode.FIXED);
            assertThat(RangeMatch.builder().startCell(valueCell("a")).build().isContiguous()).isTrue();
        }
    }

    @Nested
    class ByReference {

        @Test
        void definedName_keepsAlias() {
            Range range = RangeMatch.byReference("r", "PROFIT_RANGE").match(workbook).orElseThrow().range();

            assertThat(range.getReference(false, true, false)).isEqualTo("'Report 1'!B5:F9");
            assertThat(range.getReference()).isEqualTo("PROFIT_RANGE");
            assertThat(range.getRows()).isEqualTo(5);
            assertThat(range.getColumns()).isEqualTo(5);
        }

        @Test
        void table_resolvesOnAnySheet() {
            Range range = RangeMatch.byReference("r", "datatable").match(workbook).orElseThrow().range();

            assertThat(range.getReference(false, true, false)).isEqualTo("'Report 2'!B3:D5");
            assertThat(range.getAlias()).isEqualTo(Alias.namedTable("DataTable"));
            assertThat(range.getValue(2, 2)).isEqualTo(CellValue.number(40));
        }

        @Test
        void coordinate_onFilteredSheet() {
            RangeMatch match = RangeMatch.builder().name("r").sheet(REPORT_1).reference("B5:C6").build();

            assertThat(found(match)).isEqualTo("'Report 1'!B5:C6");
        }

        @Test
        void singleCellReference_isStillARange() {
            assertThat(found(RangeMatch.byReference("r", "DATE_CELL"))).isEqualTo("'Report 1'!C3");
        }
    }

    @Nested
    class FromStartCell {

        @Test
        void endCell_spansBothCorners() {
            RangeMatch match = RangeMatch.builder()
                    .name("r").sheet(REPORT_1).startCell(valueCell("Jan")).endCell(valueCell(4.9)).build();

            assertThat(found(match)).isEqualTo("'Report 1'!C5:F9");
        }

        @Test
        void endCellBeforeStart_isNormalised() {
            RangeMatch match = RangeMatch.builder()
                    .name("r").sheet(REPORT_1).startCell(valueCell(4.9)).endCell(valueCell("Jan")).build();

            assertThat(found(match)).isEqualTo("'Report 1'!C5:F9");
        }

        @Test
        void endCellOnOtherSheet_misses() {
            RangeMatch match = RangeMatch.builder()
                    .name("r").sheet(REPORT_1).startCell(valueCell("Jan"))
                    .endCell(CellMatch.byReference("end", "'Report 2'!D5")).build();

            assertThat(match.match(workbook)).isEmpty();
        }

        @Test
        void missingEndCell_misses() {
            RangeMatch match = RangeMatch.builder()
                    .name("r").sheet(REPORT_1).startCell(valueCell("Jan")).endCell(valueCell("Omega")).build();

            assertThat(match.match(workbook)).isEmpty();
        }

        @Test
        void fixedSize_isAnchoredAtStart() {
            RangeMatch match = RangeMatch.builder()
                    .name("r").sheet(REPORT_1).startCell(valueCell("Alpha")).rows(2).cols(3).build();

            assertThat(found(match)).isEqualTo("'Report 1'!B6:D7");
        }

        @Test
        void contiguous_fromBlankCorner_coversTable() {
            RangeMatch match = RangeMatch.builder()
                    .name("r")
                    .sheet(REPORT_1)
                    .startCell(CellMatch.builder().name("corner").value(ValueComparator.of(Operator.EMPTY))
                            .minRow(5).minCol(2).build())
                    .build();

            Optional<MatchResult> result = match.match(workbook);
            assertThat(result.map(r -> r.range().getReference(false, true, false))).contains("'Report 1'!B5:F9");
            assertThat(result.flatMap(MatchResult::capturedValue)).contains(CellValue.EMPTY_TEXT);
        }

        @Test
        void contiguous_stopsAtFirstBlank() {
            RangeMatch match = RangeMatch.builder().name("r").sheet(REPORT_1).startCell(valueCell("Alpha")).build();

            assertThat(found(match)).isEqualTo("'Report 1'!B6:F9");
        }

        @Test
        void contiguous_includesDateNextToLabel() {
            RangeMatch match = RangeMatch.builder().name("r").sheet(REPORT_1).startCell(valueCell("Date")).build();

            assertThat(found(match)).isEqualTo("'Report 1'!B3:C3");
        }

        @Test
        void missingStart_misses() {
            RangeMatch match = RangeMatch.builder().name("r").sheet(REPORT_1).startCell(valueCell("Omega")).build();

            assertThat(match.match(workbook)).isEmpty();
        }

        @Test
        void startCaptureIsKept() {
            RangeMatch match = RangeMatch.builder()
                    .name("r").sheet(REPORT_1).startCell(CellMatch.byValue("c", null, ValueComparator.regex("^Al(.*)")))
                    .rows(1).cols(1).build();

            assertThat(match.match(workbook).flatMap(MatchResult::capturedValue)).contains(CellValue.text("pha"));
        }
    }
}
