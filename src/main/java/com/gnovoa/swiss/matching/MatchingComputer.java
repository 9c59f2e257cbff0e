package com.gnovoa.swiss.matching;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Maximum weighted matching on a general undirected graph.
 *
 * <p>Primal-dual method of Edmonds with blossoms (O(n³)): every vertex and every blossom
 * keeps a dual value, an edge is tight when its slack
 * {@code dual(u) + dual(v) - 2·weight} is zero, augmenting paths are grown over tight edges
 * from every free vertex, and when the search gets stuck the duals move by the smallest
 * slack on the frontier. Odd cycles found on the way are shrunk into blossoms and expanded
 * again when their dual drops to zero.
 *
 * <p>The computer always returns a matching of maximum cardinality, and among those one of
 * maximum total weight. Weights are non-negative integers; weight 0 means "no edge".
 * Doubling the weight inside the slack keeps every dual value integral.
 *
 * <p>Not thread-safe; one instance serves one pairing computation.
 */
public final class MatchingComputer {

    private final int vertexCount;
    private final long[][] weights;

    private int[] matching;

    // ---- per-run state (see computeMatching) ----
    private int edgeCount;
    private int[] edgeFrom;
    private int[] edgeTo;
    private long[] edgeWeight;
    private int[] endpoint;
    private List<List<Integer>> neighbourEnds;
    private int[] mate;
    private int[] label;
    private int[] labelEnd;
    private int[] inBlossom;
    private int[] blossomParent;
    private List<List<Integer>> blossomChildren;
    private int[] blossomBase;
    private List<List<Integer>> blossomEndpoints;
    private int[] bestEdge;
    private List<List<Integer>> blossomBestEdges;
    private Deque<Integer> unusedBlossoms;
    private long[] dual;
    private boolean[] allowEdge;
    private List<Integer> queue;

    public MatchingComputer(int vertexCount) {
        if (vertexCount < 0) throw new IllegalArgumentException("vertexCount must not be negative");
        this.vertexCount = vertexCount;
        this.weights = new long[vertexCount][vertexCount];
        this.matching = new int[vertexCount];
        Arrays.fill(matching, -1);
    }

    public int vertexCount() {
        return vertexCount;
    }

    /**
     * Sets the weight of the undirected edge {u, v}; 0 removes the edge.
     *
     * @throws IllegalArgumentException for out-of-range vertices, loops or negative weights
     */
    public void setEdgeWeight(int u, int v, long weight) {
        if (u < 0 || v < 0 || u >= vertexCount || v >= vertexCount) {
            throw new IllegalArgumentException("Vertex index out of bounds: " + u + ", " + v);
        }
        if (u == v) throw new IllegalArgumentException("Self loops are not allowed (vertex " + u + ")");
        if (weight < 0) throw new IllegalArgumentException("Edge weight must not be negative");
        weights[u][v] = weight;
        weights[v][u] = weight;
    }

    public long edgeWeight(int u, int v) {
        return weights[u][v];
    }

    /** @return copy of the matching: partner of vertex i, or -1 when unmatched. */
    public int[] getMatching() {
        return matching.clone();
    }

    /** @return true when every vertex has a partner. */
    public boolean isComplete() {
        for (int partner : matching) {
            if (partner == -1) return false;
        }
        return true;
    }

    public int matchingSize() {
        int count = 0;
        for (int i = 0; i < vertexCount; i++) {
            if (matching[i] > i) count++;
        }
        return count;
    }

    public long matchingWeight() {
        long total = 0;
        for (int i = 0; i < vertexCount; i++) {
            if (matching[i] > i) total += weights[i][matching[i]];
        }
        return total;
    }

    /**
     * Computes a maximum-cardinality matching of maximum weight and stores it for
     * {@link #getMatching()}.
     */
    public void computeMatching() {
        buildEdges();
        matching = new int[vertexCount];
        Arrays.fill(matching, -1);
        if (edgeCount == 0) return;

        initState();
        for (int stage = 0; stage < vertexCount; stage++) {
            if (!runStage()) break;
        }

        for (int v = 0; v < vertexCount; v++) {
            matching[v] = mate[v] >= 0 ? endpoint[mate[v]] : -1;
        }
    }

    private void buildEdges() {
        List<long[]> edges = new ArrayList<>();
        for (int i = 0; i < vertexCount; i++) {
            for (int j = i + 1; j < vertexCount; j++) {
                if (weights[i][j] > 0) edges.add(new long[] {i, j, weights[i][j]});
            }
        }
        edgeCount = edges.size();
        edgeFrom = new int[edgeCount];
        edgeTo = new int[edgeCount];
        edgeWeight = new long[edgeCount];
        for (int k = 0; k < edgeCount; k++) {
            edgeFrom[k] = (int) edges.get(k)[0];
            edgeTo[k] = (int) edges.get(k)[1];
            edgeWeight[k] = edges.get(k)[2];
        }
    }

    private void initState() {
        int n = vertexCount;
        long maxWeight = 0;
        for (long w : edgeWeight) maxWeight = Math.max(maxWeight, w);

        endpoint = new int[2 * edgeCount];
        neighbourEnds = new ArrayList<>(n);
        for (int v = 0; v < n; v++) neighbourEnds.add(new ArrayList<>());
        for (int k = 0; k < edgeCount; k++) {
            endpoint[2 * k] = edgeFrom[k];
            endpoint[2 * k + 1] = edgeTo[k];
            neighbourEnds.get(edgeFrom[k]).add(2 * k + 1);
            neighbourEnds.get(edgeTo[k]).add(2 * k);
        }

        mate = new int[n];
        Arrays.fill(mate, -1);
        label = new int[2 * n];
        labelEnd = new int[2 * n];
        Arrays.fill(labelEnd, -1);
        inBlossom = new int[n];
        for (int v = 0; v < n; v++) inBlossom[v] = v;
        blossomParent = new int[2 * n];
        Arrays.fill(blossomParent, -1);
        blossomChildren = new ArrayList<>(Collections.nCopies(2 * n, (List<Integer>) null));
        blossomBase = new int[2 * n];
        for (int b = 0; b < 2 * n; b++) blossomBase[b] = b < n ? b : -1;
        blossomEndpoints = new ArrayList<>(Collections.nCopies(2 * n, (List<Integer>) null));
        bestEdge = new int[2 * n];
        Arrays.fill(bestEdge, -1);
        blossomBestEdges = new ArrayList<>(Collections.nCopies(2 * n, (List<Integer>) null));
        unusedBlossoms = new ArrayDeque<>();
        for (int b = n; b < 2 * n; b++) unusedBlossoms.push(b);
        dual = new long[2 * n];
        for (int v = 0; v < n; v++) dual[v] = maxWeight;
        allowEdge = new boolean[edgeCount];
        queue = new ArrayList<>();
    }

    /** One stage: look for an augmenting path. @return false when none can exist any more. */
    private boolean runStage() {
        int n = vertexCount;
        Arrays.fill(label, 0);
        Arrays.fill(bestEdge, -1);
        for (int b = n; b < 2 * n; b++) blossomBestEdges.set(b, null);
        Arrays.fill(allowEdge, false);
        queue.clear();

        for (int v = 0; v < n; v++) {
            if (mate[v] == -1 && label[inBlossom[v]] == 0) assignLabel(v, 1, -1);
        }

        boolean augmented = false;
        while (true) {
            while (!queue.isEmpty() && !augmented) {
                int v = queue.remove(queue.size() - 1);
                for (int p : neighbourEnds.get(v)) {
                    int k = p / 2;
                    int w = endpoint[p];
                    if (inBlossom[v] == inBlossom[w]) continue;

                    long kslack = 0;
                    if (!allowEdge[k]) {
                        kslack = slack(k);
                        if (kslack <= 0) allowEdge[k] = true;
                    }

                    if (allowEdge[k]) {
                        if (label[inBlossom[w]] == 0) {
                            assignLabel(w, 2, p ^ 1);
                        } else if (label[inBlossom[w]] == 1) {
                            int base = scanBlossom(v, w);
                            if (base >= 0) {
                                addBlossom(base, k);
                            } else {
                                augmentMatching(k);
                                augmented = true;
                                break;
                            }
                        } else if (label[w] == 0) {
                            label[w] = 2;
                            labelEnd[w] = p ^ 1;
                        }
                    } else if (label[inBlossom[w]] == 1) {
                        int b = inBlossom[v];
                        if (bestEdge[b] == -1 || kslack < slack(bestEdge[b])) bestEdge[b] = k;
                    } else if (label[w] == 0) {
                        if (bestEdge[w] == -1 || kslack < slack(bestEdge[w])) bestEdge[w] = k;
                    }
                }
            }
            if (augmented) break;

            // No augmenting path over tight edges: move the duals.
            int deltaType = -1;
            long delta = 0;
            int deltaEdge = -1;
            int deltaBlossom = -1;

            for (int v = 0; v < n; v++) {
                if (label[inBlossom[v]] == 0 && bestEdge[v] != -1) {
                    long d = slack(bestEdge[v]);
                    if (deltaType == -1 || d < delta) {
                        delta = d;
                        deltaType = 2;
                        deltaEdge = bestEdge[v];
                    }
                }
            }
            for (int b = 0; b < 2 * n; b++) {
                if (blossomParent[b] == -1 && label[b] == 1 && bestEdge[b] != -1) {
                    long d = slack(bestEdge[b]) / 2;
                    if (deltaType == -1 || d < delta) {
                        delta = d;
                        deltaType = 3;
                        deltaEdge = bestEdge[b];
                    }
                }
            }
            for (int b = n; b < 2 * n; b++) {
                if (blossomBase[b] >= 0 && blossomParent[b] == -1 && label[b] == 2
                        && (deltaType == -1 || dual[b] < delta)) {
                    delta = dual[b];
                    deltaType = 4;
                    deltaBlossom = b;
                }
            }
            if (deltaType == -1) {
                // Maximum cardinality reached: finish with a last dual update.
                deltaType = 1;
                long min = Long.MAX_VALUE;
                for (int v = 0; v < n; v++) min = Math.min(min, dual[v]);
                delta = Math.max(0, min);
            }

            for (int v = 0; v < n; v++) {
                if (label[inBlossom[v]] == 1) dual[v] -= delta;
                else if (label[inBlossom[v]] == 2) dual[v] += delta;
            }
            for (int b = n; b < 2 * n; b++) {
                if (blossomBase[b] >= 0 && blossomParent[b] == -1) {
                    if (label[b] == 1) dual[b] += delta;
                    else if (label[b] == 2) dual[b] -= delta;
                }
            }

            if (deltaType == 1) {
                break;
            } else if (deltaType == 2) {
                allowEdge[deltaEdge] = true;
                int i = edgeFrom[deltaEdge];
                int j = edgeTo[deltaEdge];
                if (label[inBlossom[i]] == 0) i = j;
                queue.add(i);
            } else if (deltaType == 3) {
                allowEdge[deltaEdge] = true;
                queue.add(edgeFrom[deltaEdge]);
            } else {
                expandBlossom(deltaBlossom, false);
            }
        }

        if (!augmented) return false;

        for (int b = n; b < 2 * n; b++) {
            if (blossomParent[b] == -1 && blossomBase[b] >= 0 && label[b] == 1 && dual[b] == 0) {
                expandBlossom(b, true);
            }
        }
        return true;
    }

    private long slack(int k) {
        return dual[edgeFrom[k]] + dual[edgeTo[k]] - 2 * edgeWeight[k];
    }

    private List<Integer> blossomLeaves(int b) {
        List<Integer> leaves = new ArrayList<>();
        collectLeaves(b, leaves);
        return leaves;
    }

    private void collectLeaves(int b, List<Integer> out) {
        if (b < vertexCount) {
            out.add(b);
            return;
        }
        for (int child : blossomChildren.get(b)) collectLeaves(child, out);
    }

    private void assignLabel(int w, int t, int p) {
        int b = inBlossom[w];
        label[w] = label[b] = t;
        labelEnd[w] = labelEnd[b] = p;
        bestEdge[w] = bestEdge[b] = -1;
        if (t == 1) {
            queue.addAll(blossomLeaves(b));
        } else if (t == 2) {
            int base = blossomBase[b];
            assignLabel(endpoint[mate[base]], 1, mate[base] ^ 1);
        }
    }

    /** Walks back from v and w; @return base of a new blossom, or -1 for an augmenting path. */
    private int scanBlossom(int v, int w) {
        List<Integer> path = new ArrayList<>();
        int base = -1;
        while (v != -1 || w != -1) {
            int b = inBlossom[v];
            if ((label[b] & 4) != 0) {
                base = blossomBase[b];
                break;
            }
            path.add(b);
            label[b] = 5;
            if (labelEnd[b] == -1) {
                v = -1;
            } else {
                v = endpoint[labelEnd[b]];
                b = inBlossom[v];
                v = endpoint[labelEnd[b]];
            }
            if (w != -1) {
                int tmp = v;
                v = w;
                w = tmp;
            }
        }
        for (int b : path) label[b] = 1;
        return base;
    }

    private void addBlossom(int base, int k) {
        int v = edgeFrom[k];
        int w = edgeTo[k];
        int bb = inBlossom[base];
        int bv = inBlossom[v];
        int bw = inBlossom[w];

        int b = unusedBlossoms.pop();
        blossomBase[b] = base;
        blossomParent[b] = -1;
        blossomParent[bb] = b;

        List<Integer> path = new ArrayList<>();
        List<Integer> endps = new ArrayList<>();
        while (bv != bb) {
            blossomParent[bv] = b;
            path.add(bv);
            endps.add(labelEnd[bv]);
            v = endpoint[labelEnd[bv]];
            bv = inBlossom[v];
        }
        path.add(bb);
        Collections.reverse(path);
        Collections.reverse(endps);
        endps.add(2 * k);
        while (bw != bb) {
            blossomParent[bw] = b;
            path.add(bw);
            endps.add(labelEnd[bw] ^ 1);
            w = endpoint[labelEnd[bw]];
            bw = inBlossom[w];
        }
        blossomChildren.set(b, path);
        blossomEndpoints.set(b, endps);

        label[b] = 1;
        labelEnd[b] = labelEnd[bb];
        dual[b] = 0;

        for (int leaf : blossomLeaves(b)) {
            if (label[inBlossom[leaf]] == 2) queue.add(leaf);
            inBlossom[leaf] = b;
        }

        int[] bestEdgeTo = new int[2 * vertexCount];
        Arrays.fill(bestEdgeTo, -1);
        for (int child : path) {
            List<List<Integer>> edgeLists = new ArrayList<>();
            if (blossomBestEdges.get(child) == null) {
                for (int leaf : blossomLeaves(child)) {
                    List<Integer> list = new ArrayList<>();
                    for (int p : neighbourEnds.get(leaf)) list.add(p / 2);
                    edgeLists.add(list);
                }
            } else {
                edgeLists.add(blossomBestEdges.get(child));
            }
            for (List<Integer> list : edgeLists) {
                for (int e : list) {
                    int i = edgeFrom[e];
                    int j = edgeTo[e];
                    if (inBlossom[j] == b) {
                        int tmp = i;
                        i = j;
                        j = tmp;
                    }
                    int bj = inBlossom[j];
                    if (bj != b && label[bj] == 1 && (bestEdgeTo[bj] == -1 || slack(e) < slack(bestEdgeTo[bj]))) {
                        bestEdgeTo[bj] = e;
                    }
                }
            }
            blossomBestEdges.set(child, null);
            bestEdge[child] = -1;
        }

        List<Integer> best = new ArrayList<>();
        for (int e : bestEdgeTo) {
            if (e != -1) best.add(e);
        }
        blossomBestEdges.set(b, best);
        bestEdge[b] = -1;
        for (int e : best) {
            if (bestEdge[b] == -1 || slack(e) < slack(bestEdge[b])) bestEdge[b] = e;
        }
    }

    private void expandBlossom(int b, boolean endStage) {
        List<Integer> children = blossomChildren.get(b);
        List<Integer> endps = blossomEndpoints.get(b);

        for (int s : children) {
            blossomParent[s] = -1;
            if (s < vertexCount) {
                inBlossom[s] = s;
            } else if (endStage && dual[s] == 0) {
                expandBlossom(s, true);
            } else {
                for (int leaf : blossomLeaves(s)) inBlossom[leaf] = s;
            }
        }

        if (!endStage && label[b] == 2) {
            // Relabel the sub-blossoms on the even-length path through the expanded T-blossom.
            int entryChild = inBlossom[endpoint[labelEnd[b] ^ 1]];
            int j = children.indexOf(entryChild);
            int jstep;
            int endpTrick;
            if ((j & 1) != 0) {
                j -= children.size();
                jstep = 1;
                endpTrick = 0;
            } else {
                jstep = -1;
                endpTrick = 1;
            }

            int p = labelEnd[b];
            while (j != 0) {
                label[endpoint[p ^ 1]] = 0;
                label[endpoint[at(endps, j - endpTrick) ^ endpTrick ^ 1]] = 0;
                assignLabel(endpoint[p ^ 1], 2, p);
                allowEdge[at(endps, j - endpTrick) / 2] = true;
                j += jstep;
                p = at(endps, j - endpTrick) ^ endpTrick;
                allowEdge[p / 2] = true;
                j += jstep;
            }

            int bv = at(children, j);
            label[endpoint[p ^ 1]] = label[bv] = 2;
            labelEnd[endpoint[p ^ 1]] = labelEnd[bv] = p;
            bestEdge[bv] = -1;

            j += jstep;
            while (at(children, j) != entryChild) {
                bv = at(children, j);
                if (label[bv] == 1) {
                    j += jstep;
                    continue;
                }
                int reached = -1;
                for (int leaf : blossomLeaves(bv)) {
                    if (label[leaf] != 0) {
                        reached = leaf;
                        break;
                    }
                }
                if (reached != -1) {
                    label[reached] = 0;
                    label[endpoint[mate[blossomBase[bv]]]] = 0;
                    assignLabel(reached, 2, labelEnd[reached]);
                }
                j += jstep;
            }
        }

        label[b] = -1;
        labelEnd[b] = -1;
        blossomChildren.set(b, null);
        blossomEndpoints.set(b, null);
        blossomBase[b] = -1;
        blossomBestEdges.set(b, null);
        bestEdge[b] = -1;
        unusedBlossoms.push(b);
    }

    /** Swaps matched and unmatched edges along the alternating path from v to the base of b. */
    private void augmentBlossom(int b, int v) {
        int t = v;
        while (blossomParent[t] != b) t = blossomParent[t];
        if (t >= vertexCount) augmentBlossom(t, v);

        List<Integer> children = blossomChildren.get(b);
        List<Integer> endps = blossomEndpoints.get(b);
        int i = children.indexOf(t);
        int j = i;
        int jstep;
        int endpTrick;
        if ((i & 1) != 0) {
            j -= children.size();
            jstep = 1;
            endpTrick = 0;
        } else {
            jstep = -1;
            endpTrick = 1;
        }

        while (j != 0) {
            j += jstep;
            t = at(children, j);
            int p = at(endps, j - endpTrick) ^ endpTrick;
            if (t >= vertexCount) augmentBlossom(t, endpoint[p]);
            j += jstep;
            t = at(children, j);
            if (t >= vertexCount) augmentBlossom(t, endpoint[p ^ 1]);
            mate[endpoint[p]] = p ^ 1;
            mate[endpoint[p ^ 1]] = p;
        }

        blossomChildren.set(b, rotate(children, i));
        blossomEndpoints.set(b, rotate(endps, i));
        blossomBase[b] = blossomBase[blossomChildren.get(b).get(0)];
    }

    private void augmentMatching(int k) {
        int[][] starts = {{edgeFrom[k], 2 * k + 1}, {edgeTo[k], 2 * k}};
        for (int[] start : starts) {
            int s = start[0];
            int p = start[1];
            while (true) {
                int bs = inBlossom[s];
                if (bs >= vertexCount) augmentBlossom(bs, s);
                mate[s] = p;
                if (labelEnd[bs] == -1) break;

                int t = endpoint[labelEnd[bs]];
                int bt = inBlossom[t];
                s = endpoint[labelEnd[bt]];
                int j = endpoint[labelEnd[bt] ^ 1];
                if (bt >= vertexCount) augmentBlossom(bt, j);
                mate[j] = labelEnd[bt];
                p = labelEnd[bt] ^ 1;
            }
        }
    }

    /** Index with wrap-around for negative positions. */
    private static int at(List<Integer> list, int index) {
        return list.get(Math.floorMod(index, list.size()));
    }

    private static List<Integer> rotate(List<Integer> list, int from) {
        List<Integer> rotated = new ArrayList<>(list.subList(from, list.size()));
        rotated.addAll(list.subList(0, from));
        return rotated;
    }
}
