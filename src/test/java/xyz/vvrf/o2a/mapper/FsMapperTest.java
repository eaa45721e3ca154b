package xyz.vvrf.o2a.mapper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.core.WorkflowStructureException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xyz.vvrf.o2a.test.util.WorkflowXml.context;

class FsMapperTest {

    @Test
    @DisplayName("每个操作生成一个单元，命令按声明顺序")
    void expandsOperationsIntoUnits() {
        FsMapper mapper = new FsMapper(context("clean_up", "fs",
                "<fs>"
                        + "<delete path=\"${root}/out\"/>"
                        + "<mkdir path=\"/tmp/a b\"/>"
                        + "<move source=\"/a\" target=\"/b\"/>"
                        + "<chmod path=\"/c\" permissions=\"755\"><recursive/></chmod>"
                        + "<touchz path=\"/d\"/>"
                        + "<chgrp path=\"/e\" group=\"staff\"/>"
                        + "<setrep path=\"/f\" replication-factor=\"2\"/>"
                        + "</fs>",
                Map.of("root", "/user/tester")));

        assertEquals(List.of("clean_up_fs_0", "clean_up_fs_1", "clean_up_fs_2", "clean_up_fs_3",
                "clean_up_fs_4", "clean_up_fs_5", "clean_up_fs_6"), mapper.getTaskIds());
        assertEquals(List.of(
                "hadoop fs -rm -r /user/tester/out",
                "hadoop fs -mkdir '/tmp/a b'",
                "hadoop fs -mv /a /b",
                "hadoop fs -chmod -R 755 /c",
                "hadoop fs -touchz /d",
                "hadoop fs -chgrp staff /e",
                "hadoop fs -setrep 2 /f"), mapper.getCommands());
        assertEquals("clean_up_fs_0", mapper.getFirstTaskId());
        assertEquals("clean_up_fs_6", mapper.getLastTaskId());
    }

    @Test
    void skipTrashFlag() {
        FsMapper mapper = new FsMapper(context("rm", "fs",
                "<fs><delete path=\"/x\" skip-trash=\"true\"/><delete path=\"/y\" skip-trash=\"false\"/></fs>"));

        assertEquals(List.of("hadoop fs -rm -r /x -skipTrash", "hadoop fs -rm -r /y"), mapper.getCommands());
    }

    @Test
    @DisplayName("只有第一个单元使用传入的触发规则，单元之间串联")
    void chainsUnitsInFragment() {
        FsMapper mapper = new FsMapper(context("fs_node", "fs",
                "<fs><mkdir path=\"/a\"/><mkdir path=\"/b\"/></fs>"));

        String text = mapper.convertToText(TriggerRule.ONE_FAILED);

        assertTrue(text.contains("task_id='fs_node_fs_0',\n    trigger_rule='one_failed',"));
        assertTrue(text.contains("task_id='fs_node_fs_1',\n    trigger_rule='all_success',"));
        assertTrue(text.endsWith("fs_node_fs_0.set_downstream(fs_node_fs_1)\n"));
    }

    @Test
    void emptyFsBecomesSingleDummyTask() {
        FsMapper mapper = new FsMapper(context("noop", "fs", "<fs/>"));

        assertEquals(List.of("noop"), mapper.getTaskIds());
        assertTrue(mapper.getCommands().isEmpty());
        String text = mapper.convertToText(TriggerRule.ALL_SUCCESS);
        assertTrue(text.startsWith("noop = dummy_operator.DummyOperator("));
        assertFalse(text.contains("set_downstream"));
    }

    @Test
    void unknownOperationIsRejected() {
        WorkflowStructureException e = assertThrows(WorkflowStructureException.class,
                () -> new FsMapper(context("bad", "fs", "<fs><copy path=\"/a\"/></fs>")));
        assertTrue(e.getMessage().contains("copy"));
    }

    @Test
    void missingAttributeIsRejected() {
        assertThrows(WorkflowStructureException.class,
                () -> new FsMapper(context("bad", "fs", "<fs><move source=\"/a\"/></fs>")));
    }
}
