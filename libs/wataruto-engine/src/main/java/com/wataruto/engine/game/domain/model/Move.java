package com.wataruto.engine.game.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.wataruto.engine.core.Command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一步落子：{@code player} 放下的一条 3~5 格直线。
 * <p>
 * 构造器只拷贝路径（允许空格子/空层，不做任何校验）；直线、连续、层规则统一由
 * {@code MoveValidator} 判定，外部传入的畸形落子由规则引擎拒绝，而不是在这里抛异常。
 * 相等性不看 {@code timestamp}，它只用于历史排序。
 */
public record Move(Player player, List<Position> path, long timestamp) implements Command {

    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 5;

    public Move {
        Objects.requireNonNull(player, "player must not be null");
        Objects.requireNonNull(path, "path must not be null");
        // List.copyOf 不接受 null 元素，这里保留原样交给校验器
        path = Collections.unmodifiableList(new ArrayList<>(path));
    }

    public static Move of(Player player, List<Position> path) {
        return new Move(player, path, System.currentTimeMillis());
    }

    @JsonIgnore
    public int length() {
        return path.size();
    }

    /** 桥接落子写第二层，起点必须是自己的锚点 */
    @JsonIgnore
    public boolean isBridge() {
        return !path.isEmpty() && path.get(0) != null && path.get(0).layer() == Layer.SECONDARY;
    }

    @JsonIgnore
    public Position start() {
        return path.get(0);
    }

    @JsonIgnore
    public Position end() {
        return path.get(path.size() - 1);
    }

    @JsonIgnore
    public Orientation orientation() {
        if (path.size() < 2) return Orientation.INVALID;
        Position first = path.get(0), second = path.get(1);
        if (first == null || second == null) return Orientation.INVALID;
        if (first.row() == second.row()) return Orientation.HORIZONTAL;
        if (first.col() == second.col()) return Orientation.VERTICAL;
        return Orientation.INVALID;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Move other)) return false;
        return player == other.player && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(player, path);
    }

    @Override
    public String toString() {
        if (path.isEmpty()) return "Move(" + player + ", empty)";
        Position s = start(), e = end();
        if (s == null || e == null) return "Move(" + player + ", path=" + path + ")";
        return "Move(" + player + ", size=" + path.size()
                + ", from=(" + s.row() + "," + s.col() + ")"
                + ", to=(" + e.row() + "," + e.col() + ")"
                + (isBridge() ? ", bridge" : "") + ")";
    }

    public enum Orientation {
        HORIZONTAL,
        VERTICAL,
        INVALID
    }
}
