package xyz.vvrf.o2a.mapper;

import xyz.vvrf.o2a.core.ArchiveCapable;
import xyz.vvrf.o2a.core.FileCapable;
import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.PrepareCapable;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.util.PythonLiterals;

import java.util.Set;

/**
 * map-reduce 动作，转换为 Dataproc 上的 Hadoop 作业。
 *
 * @author ruifeng.wen
 */
public class MapReduceMapper extends AbstractActionMapper implements PrepareCapable, FileCapable, ArchiveCapable {

    private final String nameNode;

    public MapReduceMapper(MapperContext context) {
        super(context);
        this.nameNode = requiredText("name-node");
    }

    public String getNameNode() {
        return nameNode;
    }

    @Override
    public String convertToText(TriggerRule triggerRule) {
        return name + " = dataproc_operator.DataProcHadoopOperator(\n"
                + taskIdArg(name)
                + triggerRuleArg(triggerRule.getValue())
                + arg("main_class", PythonLiterals.quote(properties.getOrDefault("mapred.mapper.class",
                "org.apache.hadoop.mapred.lib.IdentityMapper")))
                + arg("dataproc_hadoop_properties", PythonLiterals.dict(properties))
                + arg("dataproc_hadoop_jars", PythonLiterals.list(getArchives()))
                + arg("files", PythonLiterals.list(getFiles()))
                + arg("cluster_name", clusterNameExpression())
                + arg("params", "PARAMS")
                + ")\n";
    }

    @Override
    public Set<String> requiredImports() {
        return Set.of("from airflow.contrib.operators import dataproc_operator");
    }
}
