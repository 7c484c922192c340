package com.forex.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    /**
     * 数据点集合名称
     */
    private String collection = "datapoints";

    private Preparation preparation = new Preparation();

    private Loading loading = new Loading();

    private WorkerPool workerPool = new WorkerPool();

    private Backtest backtest = new Backtest();

    @Data
    public static class Preparation {
        /**
         * 相邻Tick时间差超过该秒数视为交易时段中断
         */
        private long sessionGapSeconds = 60;
        /**
         * 窗口达到该大小时写入最早的部分
         */
        private int flushThreshold = 2000;
        /**
         * 写入后窗口保留的最新Tick数
         */
        private int retain = 1000;
    }

    @Data
    public static class Loading {
        private int batchSize = 1000;
    }

    @Data
    public static class WorkerPool {
        /**
         * 线程数，0 表示使用可用处理器数量
         */
        private int size = 0;
        private String threadNamePrefix = "optimizer-worker-";
        private int awaitTerminationSeconds = 30;

        public int resolveSize() {
            return size > 0 ? size : Runtime.getRuntime().availableProcessors();
        }
    }

    @Data
    public static class Backtest {
        private String strategy = "reversals";
        private int group = 0;
        private double investment = 1000.0;
        private double profitability = 0.76;
        private int top = 10;
    }
}
