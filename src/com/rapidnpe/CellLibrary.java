package com.rapidnpe;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered set of cells addressed by their single-character name.
 * The library is read-only while expressions are evaluated against it.
 */
public class CellLibrary implements Iterable<Cell> {
    private final Map<Character, Cell> name2Cell;

    public CellLibrary() {
        name2Cell = new LinkedHashMap<>();
    }

    public CellLibrary(Collection<Cell> cells) {
        this();
        for (Cell cell : cells) {
            addCell(cell);
        }
    }

    public void addCell(Cell cell) {
        if (name2Cell.containsKey(cell.getName())) {
            throw new IllegalArgumentException("Duplicate cell name in library: " + cell.getName());
        }
        name2Cell.put(cell.getName(), cell);
    }

    public Cell getCell(char name) {
        return name2Cell.get(name);
    }

    public boolean containsCell(char name) {
        return name2Cell.containsKey(name);
    }

    public int getCellNum() {
        return name2Cell.size();
    }

    public double getTotalCellArea() {
        double totalArea = 0.0;
        for (Cell cell : name2Cell.values()) {
            totalArea += cell.getArea();
        }
        return totalArea;
    }

    public Collection<Cell> getCells() {
        return Collections.unmodifiableCollection(name2Cell.values());
    }

    @Override
    public Iterator<Cell> iterator() {
        return getCells().iterator();
    }
}
