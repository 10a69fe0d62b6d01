package com.gotopipe.stacker;

public class Const {
    public static class Config {
        public static final String VERTX_CONFIG_PATH_PROP = "vertx-config-path";
        public static final String LOCAL_CONFIG_PATH = "conf/local-config.json";

        public static final String IndependentColumnsProp = "stacking_independent_columns";
        public static final String NStackProp = "stacking_nstack";
        public static final String MaxSeqProp = "stacking_maxseq";
        public static final String MaxGapSecondsProp = "stacking_max_gap_seconds";
        public static final String FromDateProp = "stacking_from_date";
        public static final String ToDateProp = "stacking_to_date";
        public static final String PartitionParallelismProp = "stacking_partition_parallelism";
        public static final String RunIntervalSecondsProp = "stacking_run_interval_seconds";
        public static final String JdbcUrlProp = "stacking_jdbc_url";
        public static final String JdbcPoolSizeProp = "stacking_jdbc_pool_size";
        public static final String InternalApiTokenProp = "stacking_internal_api_token";
        public static final String HttpPortProp = "stacking_http_port";
    }

    public static class Event {
        public static final String StackingRun = "stacking.run";
        public static final String StackingCompleted = "stacking.completed";
    }

    public static class Port {
        public static final int ServicePortForStacker = 8091;
        public static final int PrometheusPortForStacker = 9091;
    }
}
