package xyz.vvrf.o2a.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * 两个最小执行单元 (task_id) 之间的控制流关系（不可变数据类）。
 * 注意两端是任务 ID 而不是节点名：多单元节点以最后一个单元作为起点，以第一个单元作为终点。
 * 自然顺序为 (from, to) 的字典序，保证生成文件中关系的输出顺序稳定。
 *
 * @author ruifeng.wen
 */
public final class Relation implements Comparable<Relation> {

    private static final Comparator<Relation> ORDER = Comparator
            .comparing(Relation::getFromTaskId)
            .thenComparing(Relation::getToTaskId);

    private final String fromTaskId;
    private final String toTaskId;

    /**
     * @param fromTaskId 上游任务 ID (不能为空)
     * @param toTaskId   下游任务 ID (不能为空)
     */
    public Relation(String fromTaskId, String toTaskId) {
        this.fromTaskId = Objects.requireNonNull(fromTaskId, "上游任务 ID 不能为空");
        this.toTaskId = Objects.requireNonNull(toTaskId, "下游任务 ID 不能为空");
    }

    public String getFromTaskId() {
        return fromTaskId;
    }

    public String getToTaskId() {
        return toTaskId;
    }

    @Override
    public int compareTo(Relation other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relation that = (Relation) o;
        return fromTaskId.equals(that.fromTaskId) && toTaskId.equals(that.toTaskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromTaskId, toTaskId);
    }

    @Override
    public String toString() {
        return String.format("Relation[%s -> %s]", fromTaskId, toTaskId);
    }
}
