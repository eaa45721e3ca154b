package xyz.vvrf.o2a.core;

/**
 * 目标 DAG 中任务的激活条件 (Airflow trigger_rule)。
 *
 * @author ruifeng.wen
 */
public enum TriggerRule {
    /** 所有上游都成功才执行，也是入口节点的默认值 */
    ALL_SUCCESS("all_success"),
    /** 任一上游失败时执行 */
    ONE_FAILED("one_failed"),
    /** 不论上游结果如何都执行 */
    DUMMY("dummy");

    private final String value;

    TriggerRule(String value) {
        this.value = value;
    }

    /**
     * @return 生成代码中使用的字符串值
     */
    public String getValue() {
        return value;
    }

    /**
     * 由节点的入边分类得到激活条件。
     *
     * @param reachableOnSuccess 是否被某个节点的成功边 (ok / to / case) 指向
     * @param reachableOnError   是否被某个节点的 error 边指向
     * @return 对应的激活条件
     */
    public static TriggerRule of(boolean reachableOnSuccess, boolean reachableOnError) {
        if (reachableOnSuccess && reachableOnError) {
            return DUMMY;
        }
        if (reachableOnError) {
            return ONE_FAILED;
        }
        // 只被成功边指向，或者没有任何入边 (入口节点)
        return ALL_SUCCESS;
    }
}
