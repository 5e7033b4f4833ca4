package com.itinera.server.planner;

import com.itinera.pojo.entity.Place;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 一次构建中「还可以排进后续天」的地点快照，不可变。
 * <p>每天排完后调用 {@link #consume} 得到新的快照；剩余太少时用 {@link #replenishIfBelow} 重新开放整个工作集。</p>
 */
public final class PlacePool {

    private final List<Place> workingSet;
    private final List<Place> available;

    private PlacePool(List<Place> workingSet, List<Place> available) {
        this.workingSet = workingSet;
        this.available = available;
    }

    public static PlacePool of(List<Place> workingSet) {
        List<Place> copy = List.copyOf(workingSet);
        return new PlacePool(copy, copy);
    }

    public List<Place> available() {
        return available;
    }

    public int size() {
        return available.size();
    }

    /**
     * 去掉已用过的地点。
     */
    public PlacePool consume(Collection<String> usedPlaceIds) {
        if (usedPlaceIds == null || usedPlaceIds.isEmpty()) {
            return this;
        }
        Set<String> used = new HashSet<>(usedPlaceIds);
        List<Place> rest = available.stream()
                .filter(p -> !used.contains(p.getId()))
                .collect(Collectors.toUnmodifiableList());
        return new PlacePool(workingSet, rest);
    }

    /**
     * 剩余少于 threshold 时回到完整工作集。
     */
    public PlacePool replenishIfBelow(int threshold) {
        if (available.size() < threshold && available.size() < workingSet.size()) {
            return new PlacePool(workingSet, workingSet);
        }
        return this;
    }

    public List<Place> workingSet() {
        return workingSet;
    }
}
