package org.outbreak.runtime.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Uniform bucket index over the current agent positions.
 * <p>
 * The grid is derived data: {@link #rebuild} replaces its whole content from the agents' positions and
 * nothing else mutates it. With a cell size of at least the query radius, every agent within that
 * radius of a query agent lies in the query agent's cell or one of its eight neighbours, so
 * {@link #queryNeighbors} never misses a contact; it may return agents farther away, which callers
 * filter by distance.
 */
public class SpatialGrid {

    private double cellSize = 1.0;
    private int cols = 0;
    private int rows = 0;
    private List<List<Agent>> cells = List.of();

    /**
     * Buckets every agent by its clamped cell coordinates. Runs in O(n + cells).
     *
     * @param agents The agents to index.
     * @param cellSize The edge length of a cell, must be > 0.
     * @param bounds The field the agents live in.
     */
    public void rebuild(Collection<Agent> agents, double cellSize, FieldBounds bounds) {
        if (!(cellSize > 0)) {
            throw new IllegalArgumentException("cellSize must be > 0 but was " + cellSize);
        }
        this.cellSize = cellSize;
        this.cols = Math.max(1, (int) Math.ceil(bounds.width() / cellSize));
        this.rows = Math.max(1, (int) Math.ceil(bounds.height() / cellSize));

        List<List<Agent>> fresh = new ArrayList<>(cols * rows);
        for (int i = 0; i < cols * rows; i++) {
            fresh.add(new ArrayList<>());
        }
        for (Agent agent : agents) {
            fresh.get(flat(cellX(agent.getX()), cellY(agent.getY()))).add(agent);
        }
        this.cells = fresh;
    }

    /**
     * Returns all indexed agents in the 3x3 block of cells centred on the agent's cell, excluding the
     * agent itself.
     *
     * @param agent The query agent.
     * @return The candidate neighbours, in cell order.
     */
    public List<Agent> queryNeighbors(Agent agent) {
        List<Agent> out = new ArrayList<>();
        if (cells.isEmpty()) {
            return out;
        }
        int cx = cellX(agent.getX());
        int cy = cellY(agent.getY());

        for (int ox = -1; ox <= 1; ox++) {
            for (int oy = -1; oy <= 1; oy++) {
                int nx = cx + ox;
                int ny = cy + oy;
                if (nx < 0 || ny < 0 || nx >= cols || ny >= rows) continue;

                for (Agent other : cells.get(flat(nx, ny))) {
                    if (other != agent) out.add(other);
                }
            }
        }
        return out;
    }

    private int cellX(double x) {
        return clamp((int) Math.floor(x / cellSize), cols - 1);
    }

    private int cellY(double y) {
        return clamp((int) Math.floor(y / cellSize), rows - 1);
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(max, value));
    }

    private int flat(int cx, int cy) {
        return cx + cy * cols;
    }

    public double getCellSize() { return cellSize; }
    public int getCols() { return cols; }
    public int getRows() { return rows; }

    /**
     * @return The number of agents currently indexed.
     */
    public int size() {
        int n = 0;
        for (List<Agent> cell : cells) {
            n += cell.size();
        }
        return n;
    }
}
