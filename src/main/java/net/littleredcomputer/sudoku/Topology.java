// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;

/**
 * The fixed structure of the 9x9 board: 27 units (9 rows, 9 columns, 9 boxes),
 * and for each cell its three units and its 20 peers. Computed once when the
 * class is loaded; everything handed out is immutable.
 */
public final class Topology {
    private static final ImmutableList<ImmutableList<Cell>> ROWS;
    private static final ImmutableList<ImmutableList<Cell>> COLUMNS;
    private static final ImmutableList<ImmutableList<Cell>> BOXES;
    private static final ImmutableList<ImmutableList<Cell>> UNIT_LIST;
    private static final ImmutableList<ImmutableList<ImmutableList<Cell>>> UNITS;
    private static final ImmutableList<ImmutableSet<Cell>> PEERS;

    static {
        ImmutableList.Builder<ImmutableList<Cell>> rows = ImmutableList.builder();
        ImmutableList.Builder<ImmutableList<Cell>> columns = ImmutableList.builder();
        ImmutableList.Builder<ImmutableList<Cell>> boxes = ImmutableList.builder();
        for (int i = 0; i < Cell.SIZE; ++i) {
            ImmutableList.Builder<Cell> row = ImmutableList.builder();
            ImmutableList.Builder<Cell> column = ImmutableList.builder();
            ImmutableList.Builder<Cell> box = ImmutableList.builder();
            int br = 3 * (i / 3);
            int bc = 3 * (i % 3);
            for (int j = 0; j < Cell.SIZE; ++j) {
                row.add(Cell.of(i, j));
                column.add(Cell.of(j, i));
                box.add(Cell.of(br + j / 3, bc + j % 3));
            }
            rows.add(row.build());
            columns.add(column.build());
            boxes.add(box.build());
        }
        ROWS = rows.build();
        COLUMNS = columns.build();
        BOXES = boxes.build();
        UNIT_LIST = ImmutableList.<ImmutableList<Cell>>builder().addAll(ROWS).addAll(COLUMNS).addAll(BOXES).build();

        ImmutableList.Builder<ImmutableList<ImmutableList<Cell>>> unitsOf = ImmutableList.builderWithExpectedSize(Cell.COUNT);
        ImmutableList.Builder<ImmutableSet<Cell>> peersOf = ImmutableList.builderWithExpectedSize(Cell.COUNT);
        for (Cell c : Cell.all()) {
            ImmutableList<ImmutableList<Cell>> units = ImmutableList.of(ROWS.get(c.row()), COLUMNS.get(c.column()), BOXES.get(c.box()));
            unitsOf.add(units);
            // ImmutableSet keeps insertion order, so peers iterate row, then column, then the rest of the box.
            ImmutableSet.Builder<Cell> peers = ImmutableSet.builder();
            for (List<Cell> u : units) {
                for (Cell p : u) {
                    if (p != c) peers.add(p);
                }
            }
            peersOf.add(peers.build());
        }
        UNITS = unitsOf.build();
        PEERS = peersOf.build();
    }

    private Topology() {}

    /** The row, column and box containing {@code c}, in that order. Each includes {@code c} itself. */
    public static ImmutableList<ImmutableList<Cell>> units(Cell c) {
        return UNITS.get(c.index());
    }

    /** The 20 cells that share a unit with {@code c}. */
    public static ImmutableSet<Cell> peers(Cell c) {
        return PEERS.get(c.index());
    }

    /** All 27 units: the 9 rows, then the 9 columns, then the 9 boxes. */
    public static ImmutableList<ImmutableList<Cell>> unitList() {
        return UNIT_LIST;
    }

    public static ImmutableList<Cell> row(int r) { return ROWS.get(r); }
    public static ImmutableList<Cell> column(int c) { return COLUMNS.get(c); }
    public static ImmutableList<Cell> box(int b) { return BOXES.get(b); }
}
