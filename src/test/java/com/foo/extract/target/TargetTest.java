package com.foo.extract.target;

import com.foo.extract.TestWorkbooks;
import com.foo.extract.match.CellMatch;
import com.foo.extract.match.CellValue;
import com.foo.extract.match.ExtractConfigurationException;
import com.foo.extract.match.MatchResult;
import com.foo.extract.match.RangeMatch;
import com.foo.extract.match.ValueComparator;
import com.foo.extract.util.CellValueUtils;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.foo.extract.TestWorkbooks.value;
import static org.assertj.core.api.Assertions.*;

class TargetTest {

    private XSSFWorkbook source;
    private XSSFWorkbook target;
    private Sheet summary;

    @BeforeEach
    void setUp() {
        source = TestWorkbooks.source();
        target = TestWorkbooks.target();
        summary = target.getSheet("Summary");
    }

    @AfterEach
    void tearDown() throws Exception {
        source.close();
        target.close();
    }

    private static RangeMatch profitRange() {
        return RangeMatch.byReference("profit", "PROFIT_RANGE");
    }

    private static RangeMatch summaryTable() {
        return RangeMatch.byReference("summary", "SUMMARY_TABLE");
    }

    private static CellMatch label(Object text) {
        return CellMatch.byValue("label", null, ValueComparator.equalTo(text));
    }

    private List<Object> values(String... coordinates) {
        return Arrays.stream(coordinates).map(c -> value(summary, c)).toList();
    }

    @Nested
    class Construction {

        @Test
        void missingSide_throws() {
            assertThatThrownBy(() -> Target.builder().source(profitRange()).build())
                    .isInstanceOf(ExtractConfigurationException.class);
        }

        @Test
        void locatorOnCellSource_throws() {
            assertThatThrownBy(() -> Target.builder()
                    .source(CellMatch.byReference("date", "DATE_CELL"))
                    .target(CellMatch.byReference("out", "C3"))
                    .sourceRow(label("Beta"))
                    .build())
                    .isInstanceOf(ExtractConfigurationException.class)
                    .hasMessageContaining("range source");
        }

        @Test
        void rangeToCell_withoutBothLocators_throws() {
            assertThatThrownBy(() -> Target.builder()
                    .source(profitRange())
                    .target(CellMatch.byReference("out", "C3"))
                    .sourceRow(label("Beta"))
                    .build())
                    .isInstanceOf(ExtractConfigurationException.class)
                    .hasMessage("profit: A source row and column must be specified if the source is a range and "
                            + "the target is a cell");
        }

        @Test
        void cellToRange_withoutBothLocators_throws() {
            assertThatThrownBy(() -> Target.builder()
                    .source(CellMatch.byReference("date", "DATE_CELL"))
                    .target(summaryTable())
                    .build())
                    .isInstanceOf(ExtractConfigurationException.class)
                    .hasMessageContaining("A target row and column must be specified");
        }

        @Test
        void tableToCell_throws() {
            assertThatThrownBy(() -> Target.builder()
                    .source(profitRange())
                    .target(summaryTable())
                    .targetRow(label("Profit"))
                    .targetCol(label("Delta"))
                    .build())
                    .isInstanceOf(ExtractConfigurationException.class)
                    .hasMessageContaining("Cannot copy a table to a single cell");
        }

        @Test
        void vectorToTable_throws() {
            assertThatThrownBy(() -> Target.builder()
                    .source(profitRange())
                    .target(summaryTable())
                    .sourceCol(label("Feb"))
                    .build())
                    .isInstanceOf(ExtractConfigurationException.class)
                    .hasMessageContaining("exactly one of row and column");
        }

        @Test
        void alignOnTable_throws() {
            assertThatThrownBy(() -> Target.builder()
                    .source(profitRange())
                    .target(summaryTable())
                    .align(true)
                    .build())
                    .isInstanceOf(ExtractConfigurationException.class)
                    .hasMessageContaining("Align");
        }

        @Test
        void sideSheetFilter_flowsIntoLocators() {
            ValueComparator report = ValueComparator.equalTo("Report 1");
            Target t = Target.builder()
                    .source(RangeMatch.builder().name("r").sheet(report).reference("B5:F9").build())
                    .target(summaryTable())
                    .sourceRow(label("Beta"))
                    .sourceCol(label("Feb"))
                    .targetRow(label("Profit"))
                    .targetCol(label("Delta"))
                    .build();

            assertThat(t.getSourceRow().sheet()).isEqualTo(report);
            assertThat(t.getSourceCol().sheet()).isEqualTo(report);
            assertThat(t.getTargetRow().sheet()).isNull();
        }
    }

    @Nested
    class CellTransfer {

        @Test
        void cellToCell_copiesDateTime() {
            Target t = Target.builder()
                    .source(CellMatch.byReference("date", "'Report 1'!C3"))
                    .target(CellMatch.byReference("out", "'Summary'!C3"))
                    .build();

            Optional<MatchResult> result = t.extract(source, target);

            assertThat(result).isPresent();
            assertThat(CellValueUtils.read(summary, 3, 3))
                    .isEqualTo(CellValue.dateTime(LocalDateTime.of(2021, 5, 1, 0, 0)));
        }

        @Test
        void triangulated_copiesIntersection() {
            Target t = Target.builder()
                    .source(profitRange())
                    .target(summaryTable())
                    .sourceRow(label("Beta"))
                    .sourceCol(label("Feb"))
                    .targetRow(label("Profit"))
                    .targetCol(label("Delta"))
                    .build();

            assertThat(t.extract(source, target)).isPresent();
            assertThat(value(summary, "D8")).isEqualTo(7.0);
            assertThat(values("C8", "E8")).containsOnlyNulls();
        }

        @Test
        void rangeToCell_withLocators() {
            Target t = Target.builder()
                    .source(profitRange())
                    .target(CellMatch.byReference("out", "AREA_LABEL"))
                    .sourceRow(label("Gamma"))
                    .sourceCol(label("Apr"))
                    .build();

            t.extract(source, target);

            assertThat(value(summary, "B11")).isEqualTo(4.9);
        }

        @Test
        void cellToRange_withLocators() {
            Target t = Target.builder()
                    .source(CellMatch.byReference("date", "DATE_CELL").toBuilder().colOffset(-1).build())
                    .target(summaryTable())
                    .targetRow(label("Loss"))
                    .targetCol(label("Alpha"))
                    .build();

            t.extract(source, target);

            assertThat(value(summary, "C9")).isEqualTo("Date");
        }
    }

    @Nested
    class TableTransfer {

        @Test
        void replace_withoutExpand_clipsToTarget() {
            Target t = Target.builder().source(profitRange()).target(summaryTable()).build();

            t.extract(source, target);

            assertThat(values("B7", "C7", "D7", "E7")).containsExactly(null, "Jan", "Feb", "Mar");
            assertThat(values("B8", "C8", "D8", "E8")).containsExactly("Alpha", 1.5, 6.0, 11.0);
            assertThat(values("B9", "C9", "D9", "E9")).containsExactly("Beta", 2.0, 7.0, 12.0);
            assertThat(values("F7", "B10")).containsOnlyNulls();
            assertThat(value(summary, "B11")).isEqualTo("Area");
        }

        @Test
        void replace_withExpand_resizesTarget() {
            Target t = Target.builder().source(profitRange()).target(summaryTable()).expand(true).build();

            t.extract(source, target);

            assertThat(values("B7", "C7", "D7", "E7", "F7")).containsExactly(null, "Jan", "Feb", "Mar", "Apr");
            assertThat(values("B11", "C11", "D11", "E11", "F11")).containsExactly("Gamma", 3.0, 9.0, 14.0, 4.9);
            assertThat(value(summary, "B13")).isEqualTo("Area");
            assertThat(target.getName("SUMMARY_TABLE").getRefersToFormula()).isEqualTo("Summary!$B$7:$F$11");
            assertThat(target.getName("AREA_LABEL").getRefersToFormula()).isEqualTo("Summary!$B$13");
        }

        @Test
        void returnsSourceMatch() {
            Target t = Target.builder().source(profitRange()).target(summaryTable()).build();

            Optional<MatchResult> result = t.extract(source, target);

            assertThat(result.map(r -> r.range().getReference())).contains("PROFIT_RANGE");
        }
    }

    @Nested
    class VectorTransfer {

        @Test
        void align_matchesLabels() {
            Target t = Target.builder()
                    .source(profitRange())
                    .target(summaryTable())
                    .sourceCol(label("Feb"))
                    .targetRow(label("Profit"))
                    .align(true)
                    .build();

            t.extract(source, target);

            assertThat(values("B8", "C8", "D8", "E8")).containsExactly("Profit", 6.0, 8.0, 7.0);
            assertThat(values("C9", "D9", "E9")).containsOnlyNulls();
        }

        @Test
        void align_labelsIgnoreCaseAndSpaces() {
            TestWorkbooks.set(summary, 7, 4, "  delta ");
            Target t = Target.builder()
                    .source(profitRange())
                    .target(summaryTable())
                    .sourceCol(label("Mar"))
                    .targetRow(label("Loss"))
                    .align(true)
                    .build();

            t.extract(source, target);

            assertThat(values("C9", "D9", "E9")).containsExactly(11.0, 13.0, 12.0);
        }

        @Test
        void replace_positional_clipsToTarget() {
            Target t = Target.builder()
                    .source(profitRange())
                    .target(summaryTable())
                    .sourceCol(label("Feb"))
                    .targetRow(label("Profit"))
                    .build();

            t.extract(source, target);

            assertThat(values("B8", "C8", "D8", "E8", "F8")).containsExactly("Feb", 6.0, 7.0, 8.0, null);
        }

        @Test
        void replace_withExpand_growsAlongVector() {
            Target t = Target.builder()
                    .source(profitRange())
                    .target(summaryTable())
                    .sourceCol(label("Feb"))
                    .targetRow(label("Profit"))
                    .expand(true)
                    .build();

            t.extract(source, target);

            assertThat(values("B8", "C8", "D8", "E8", "F8")).containsExactly("Feb", 6.0, 7.0, 8.0, 9.0);
            assertThat(target.getName("SUMMARY_TABLE").getRefersToFormula()).isEqualTo("Summary!$B$7:$F$9");
            assertThat(value(summary, "B11")).isEqualTo("Area");
        }

        @Test
        void rowToColumn() {
            Target t = Target.builder()
                    .source(profitRange())
                    .target(summaryTable())
                    .sourceRow(label("Delta"))
                    .targetCol(label("Alpha"))
                    .build();

            t.extract(source, target);

            assertThat(values("C7", "C8", "C9")).containsExactly("Delta", 2.5, 8.0);
        }
    }

    @Nested
    class Misses {

        @Test
        void missingLocator_leavesTargetUntouched() {
            Target t = Target.builder()
                    .source(profitRange())
                    .target(summaryTable())
                    .sourceRow(label("Beta"))
                    .sourceCol(label("Feb"))
                    .targetRow(label("Profit"))
                    .targetCol(label("Omega"))
                    .build();

            assertThat(t.extract(source, target)).isEmpty();
            assertThat(values("C8", "D8", "E8")).containsOnlyNulls();
        }

        @Test
        void missingTarget_leavesTargetUntouched() {
            Target t = Target.builder()
                    .source(profitRange())
                    .target(RangeMatch.byReference("t", "NO_SUCH_TABLE"))
                    .expand(true)
                    .build();

            assertThat(t.extract(source, target)).isEmpty();
            assertThat(value(summary, "B11")).isEqualTo("Area");
        }

        @Test
        void missingSource_isEmpty() {
            Target t = Target.builder()
                    .source(RangeMatch.byReference("s", "NO_SUCH_RANGE"))
                    .target(summaryTable())
                    .build();

            assertThat(t.extract(source, target)).isEmpty();
            assertThat(values("C7")).containsExactly("Alpha");
        }
    }
}
