package xyz.vvrf.o2a.converter;

import lombok.Builder;
import lombok.Getter;
import xyz.vvrf.o2a.core.Relation;
import xyz.vvrf.o2a.core.TriggerRuleAssignment;
import xyz.vvrf.o2a.core.WorkflowGraph;

import java.nio.file.Path;
import java.time.Duration;
import java.util.SortedSet;

/**
 * 一次成功转换的结果。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
public class ConversionResult {

    private final String dagName;
    private final Path outputFile;
    private final WorkflowGraph graph;
    private final SortedSet<Relation> relations;
    private final TriggerRuleAssignment triggerRules;
    private final Duration duration;
}
