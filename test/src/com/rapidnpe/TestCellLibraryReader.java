package com.rapidnpe;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.rapidnpe.utils.HierarchicalLogger;

public class TestCellLibraryReader {

    @Test
    public void testReadExampleLibrary() throws Exception {
        Path path = Path.of(TestCellLibraryReader.class.getResource("/example_cells.txt").toURI());
        CellLibrary library = CellLibraryReader.readCellLibrary(path);

        Assertions.assertEquals(20, library.getCellNum());
        Cell cell = library.getCell('7');
        Assertions.assertEquals(12.0, cell.getArea());
        Assertions.assertEquals(3.0, cell.getAspectRatio());
        Assertions.assertFalse(cell.isFixed());
        Assertions.assertEquals(6.0, cell.getHeight(), 1e-12);
        Assertions.assertEquals(2.0, cell.getWidth(), 1e-12);
        Assertions.assertFalse(library.containsCell('h'));

        // file order is kept
        Assertions.assertEquals('1', library.iterator().next().getName());
    }

    @Test
    public void testFixedField() throws IOException {
        String text = "A 4 1 true\nB 9 1 0\n\n# comment\nC 2.5 0.4\nD 1 1 1\n";
        CellLibrary library = CellLibraryReader.readCellLibrary(new StringReader(text), "inline");

        Assertions.assertEquals(4, library.getCellNum());
        Assertions.assertTrue(library.getCell('A').isFixed());
        Assertions.assertFalse(library.getCell('B').isFixed());
        Assertions.assertFalse(library.getCell('C').isFixed());
        Assertions.assertTrue(library.getCell('D').isFixed());
        Assertions.assertEquals(16.5, library.getTotalCellArea(), 1e-12);
    }

    @Test
    public void testHashNamedCell() throws IOException {
        String text = "# cells of the top level\n# 4 1\nA 9 1\n";
        CellLibrary library = CellLibraryReader.readCellLibrary(new StringReader(text), "inline");

        Assertions.assertEquals(2, library.getCellNum());
        Assertions.assertEquals(4.0, library.getCell('#').getArea());
        Assertions.assertFalse(library.getCell('#').isFixed());

        FloorplanEvaluator evaluator = new FloorplanEvaluator(HierarchicalLogger.createPseudoLogger("test"), library);
        Assertions.assertEquals(15.0, evaluator.cost("#AV"));
    }

    @Test
    public void testMalformedRecords() {
        String[] malformedTexts = {
            "A 4\n",
            "AB 4 1\n",
            "A four 1\n",
            "A 4 1 maybe\n",
            "A -4 1\n",
            "V 4 1\n",
            "A 4 1\nA 9 1\n",
        };
        for (String text : malformedTexts) {
            IOException e = Assertions.assertThrows(IOException.class,
                () -> CellLibraryReader.readCellLibrary(new StringReader(text), "inline"));
            Assertions.assertTrue(e.getMessage().contains("inline:"), e.getMessage());
        }
    }

    @Test
    public void testMissingFile(@TempDir Path dir) {
        Assertions.assertThrows(IOException.class, () -> CellLibraryReader.readCellLibrary(dir.resolve("missing.txt")));
    }
}
