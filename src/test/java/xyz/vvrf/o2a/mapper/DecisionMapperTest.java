package xyz.vvrf.o2a.mapper;

import org.junit.jupiter.api.Test;
import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.core.WorkflowStructureException;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xyz.vvrf.o2a.test.util.WorkflowXml.context;
import static xyz.vvrf.o2a.test.util.WorkflowXml.element;

class DecisionMapperTest {

    private static final String DECISION = "<decision name=\"route\"><switch>"
            + "<case to=\"big-job\">${fs:fileSize(input) gt 10 * GB}</case>"
            + "<case to=\"small_job\">${wf:conf('mode') eq 'small'}</case>"
            + "<default to=\"skip\"/>"
            + "</switch></decision>";

    @Test
    void readsCasesInOrderAndDefault() {
        DecisionMapper mapper = DecisionMapper.of(context("route", "decision", DECISION));

        assertEquals(List.of("big_job", "small_job"),
                mapper.getCases().stream().map(DecisionMapper.Branch::getTarget).collect(Collectors.toList()));
        assertEquals("${fs:fileSize(input) gt 10 * GB}", mapper.getCases().get(0).getPredicate());
        assertEquals("skip", mapper.getDefaultTarget());
    }

    @Test
    void predicatesAreNotSubstituted() {
        DecisionMapper mapper = DecisionMapper.of(context("route", "decision",
                "<decision><switch><case to=\"a\">${mode}</case><default to=\"b\"/></switch></decision>",
                Map.of("mode", "fast")));

        assertEquals("${mode}", mapper.getCases().get(0).getPredicate());
    }

    @Test
    void templateConversion() {
        assertEquals("{{ a eq b }}", DecisionMapper.toTemplate("  ${a eq b} "));
        assertEquals("true", DecisionMapper.toTemplate("true"));
    }

    @Test
    void targetsAreResolvedToTaskIds() {
        MapperContext context = MapperContext.builder()
                .node(element(DECISION))
                .name("route")
                .type("decision")
                .taskIdResolver(target -> target + "_first")
                .build();

        String text = DecisionMapper.of(context).convertToText(TriggerRule.ALL_SUCCESS);

        assertTrue(text.startsWith("def route_decision(**context):\n"));
        assertTrue(text.contains("return 'big_job_first'"));
        assertTrue(text.contains("return 'skip_first'"));
        assertTrue(text.contains("env.from_string('{{ fs:fileSize(input) gt 10 * GB }}')"));
        assertTrue(text.contains("route = python_operator.BranchPythonOperator("));
        assertTrue(text.contains("python_callable=route_decision,"));
    }

    @Test
    void withoutDefaultFallsBackToNone() {
        DecisionMapper mapper = DecisionMapper.of(context("d", "decision",
                "<decision><switch><case to=\"a\">${x}</case></switch></decision>"));

        assertNull(mapper.getDefaultTarget());
        assertTrue(mapper.convertToText(TriggerRule.ALL_SUCCESS).contains("    return None\n"));
    }

    @Test
    void missingSwitchIsRejected() {
        assertThrows(WorkflowStructureException.class,
                () -> DecisionMapper.of(context("d", "decision", "<decision/>")));
    }
}
