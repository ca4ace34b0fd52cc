package com.nomadtap.tap.schema;

import com.nomadtap.tap.model.StreamDefinition;

import java.util.List;

import static com.nomadtap.tap.model.FieldType.ARRAY;
import static com.nomadtap.tap.model.FieldType.BOOLEAN;
import static com.nomadtap.tap.model.FieldType.INTEGER;
import static com.nomadtap.tap.model.FieldType.OBJECT;
import static com.nomadtap.tap.model.FieldType.STRING;
import static com.nomadtap.tap.model.FieldType.TIMESTAMP_NANOS;

/**
 * Stream definitions for the Nomad list endpoints.
 *
 * Field names follow the API's PascalCase stubs. Nomad list endpoints page in ID order,
 * so none of the incremental streams is sorted by ModifyIndex.
 */
public final class NomadStreams {

    public static final String MODIFY_INDEX = "ModifyIndex";

    // ── Workload ────────────────────────────────────────────────────────────

    public static final StreamDefinition JOBS = StreamDefinition.builder("jobs")
            .path("/v1/jobs")
            .field("ID", STRING)
            .field("ParentID", STRING)
            .field("Name", STRING)
            .field("Namespace", STRING)
            .field("Datacenters", ARRAY)
            .field("Type", STRING)
            .field("Priority", INTEGER)
            .field("Periodic", BOOLEAN)
            .field("ParameterizedJob", BOOLEAN)
            .field("Stop", BOOLEAN)
            .field("Status", STRING)
            .field("StatusDescription", STRING)
            .field("JobSummary", OBJECT)
            .field("CreateIndex", INTEGER)
            .field("ModifyIndex", INTEGER)
            .field("JobModifyIndex", INTEGER)
            .field("SubmitTime", TIMESTAMP_NANOS)
            .primaryKeys("ID", "Namespace")
            .incremental(MODIFY_INDEX)
            .build();

    public static final StreamDefinition ALLOCATIONS = StreamDefinition.builder("allocations")
            .path("/v1/allocations")
            .field("ID", STRING)
            .field("EvalID", STRING)
            .field("Name", STRING)
            .field("Namespace", STRING)
            .field("NodeID", STRING)
            .field("NodeName", STRING)
            .field("JobID", STRING)
            .field("JobType", STRING)
            .field("JobVersion", INTEGER)
            .field("TaskGroup", STRING)
            .field("DesiredStatus", STRING)
            .field("DesiredDescription", STRING)
            .field("ClientStatus", STRING)
            .field("ClientDescription", STRING)
            .field("FollowupEvalID", STRING)
            .field("TaskStates", OBJECT)
            .field("CreateIndex", INTEGER)
            .field("ModifyIndex", INTEGER)
            .field("CreateTime", TIMESTAMP_NANOS)
            .field("ModifyTime", TIMESTAMP_NANOS)
            .primaryKeys("ID")
            .incremental(MODIFY_INDEX)
            .build();

    // ── Cluster ─────────────────────────────────────────────────────────────

    public static final StreamDefinition NODES = StreamDefinition.builder("nodes")
            .path("/v1/nodes")
            .field("ID", STRING)
            .field("Name", STRING)
            .field("Datacenter", STRING)
            .field("NodeClass", STRING)
            .field("NodePool", STRING)
            .field("Address", STRING)
            .field("Version", STRING)
            .field("Drain", BOOLEAN)
            .field("SchedulingEligibility", STRING)
            .field("Status", STRING)
            .field("StatusDescription", STRING)
            .field("Drivers", OBJECT)
            .field("CreateIndex", INTEGER)
            .field("ModifyIndex", INTEGER)
            .primaryKeys("ID")
            .fullTable()
            .build();

    public static final StreamDefinition DEPLOYMENTS = StreamDefinition.builder("deployments")
            .path("/v1/deployments")
            .field("ID", STRING)
            .field("Namespace", STRING)
            .field("JobID", STRING)
            .field("JobVersion", INTEGER)
            .field("JobModifyIndex", INTEGER)
            .field("JobSpecModifyIndex", INTEGER)
            .field("JobCreateIndex", INTEGER)
            .field("IsMultiregion", BOOLEAN)
            .field("TaskGroups", OBJECT)
            .field("Status", STRING)
            .field("StatusDescription", STRING)
            .field("CreateIndex", INTEGER)
            .field("ModifyIndex", INTEGER)
            .primaryKeys("ID")
            .incremental(MODIFY_INDEX)
            .build();

    /** Discovery order. */
    public static final List<StreamDefinition> ALL = List.of(JOBS, ALLOCATIONS, NODES, DEPLOYMENTS);

    private NomadStreams() {
    }

    public static SchemaRegistry registry() {
        return new SchemaRegistry(ALL);
    }
}
