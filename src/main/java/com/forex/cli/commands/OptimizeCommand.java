package com.forex.cli.commands;

import com.forex.cli.AbstractCommand;
import com.forex.cli.CommandException;
import com.forex.config.OptimizerProperties;
import com.forex.optimizer.ConfigurationResolutionException;
import com.forex.optimizer.LoadedDataset;
import com.forex.optimizer.OptimizerService;
import com.forex.optimizer.configuration.Configuration;
import com.forex.optimizer.configuration.ConfigurationOption;
import com.forex.optimizer.configuration.ConfigurationOptionsReader;
import com.forex.strategy.OptimizationStrategy;
import com.forex.strategy.StrategyResults;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 参数优化命令
 * 加载已准备的数据，对全部参数组合并行回测并输出收益最高的组合
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OptimizeCommand extends AbstractCommand {

    private final OptimizerService optimizerService;
    private final ConfigurationOptionsReader optionsReader;
    private final OptimizerProperties properties;

    @Override
    public String getName() {
        return "optimize";
    }

    @Override
    public String getDescription() {
        return "对策略参数组合进行并行回测";
    }

    @Override
    public List<String> getAliases() {
        return List.of("opt");
    }

    @Override
    public List<String> getExamples() {
        return List.of(
                "optimize --symbol EURUSD",
                "optimize --symbol EURUSD --options options/reversals.json --top 20",
                "optimize --symbol EURUSD --investment 500 --profitability 0.8"
        );
    }

    @Override
    public void execute(String[] args) throws CommandException {
        Options options = createOptions();
        CommandLine cmd = parseArgs(args, options);
        if (shouldShowHelp(cmd)) {
            printUsage();
            return;
        }
        validateRequired(cmd, "symbol");

        OptimizerProperties.Backtest defaults = properties.getBacktest();
        String symbol = cmd.getOptionValue("symbol");
        String strategy = getOptionValue(cmd, "strategy", defaults.getStrategy());
        int group = getIntOptionValue(cmd, "group", defaults.getGroup());
        double investment = getDoubleOptionValue(cmd, "investment", defaults.getInvestment());
        double profitability = getDoubleOptionValue(cmd, "profitability", defaults.getProfitability());
        int top = getIntOptionValue(cmd, "top", defaults.getTop());

        Map<String, ConfigurationOption> configurationOptions = loadOptions(cmd, strategy);

        printInfo(String.format("加载 %s 数据...", symbol));
        LoadedDataset data = optimizerService.loadData(symbol);
        if (data.dataset().isEmpty()) {
            printWarning("未找到 " + symbol + " 的数据, 请先执行 prepare 命令");
            return;
        }

        List<Configuration> configurations;
        try {
            configurations = optimizerService.buildConfigurations(configurationOptions, data.dataIndex());
        } catch (ConfigurationResolutionException e) {
            throw CommandException.invalidArgument(getName(), e.getMessage());
        }
        printInfo(String.format("数据 %d 行 x %d 列, 参数组合 %d 个",
                data.dataset().getRowCount(), data.dataset().getColumnCount(), configurations.size()));

        List<OptimizationStrategy> strategies = optimizerService.optimize(strategy, symbol, group, data,
                configurations, investment, profitability);

        printResults(strategies, top);
        printSuccess("优化完成");
    }

    private Map<String, ConfigurationOption> loadOptions(CommandLine cmd, String strategy) {
        if (!cmd.hasOption("options")) {
            return optimizerService.getDefaultConfigurationOptions(strategy);
        }
        Path file = Path.of(cmd.getOptionValue("options"));
        try {
            return optionsReader.read(file);
        } catch (IOException e) {
            throw CommandException.executionFailed(getName(), "读取参数文件失败: " + e.getMessage(), e);
        }
    }

    private void printResults(List<OptimizationStrategy> strategies, int top) {
        List<OptimizationStrategy> ranked = strategies.stream()
                .sorted(Comparator.comparingDouble(
                        (OptimizationStrategy s) -> s.getResults().getProfitLoss()).reversed())
                .limit(Math.max(top, 0))
                .toList();

        printTableHeader("收益最高的 " + ranked.size() + " 个参数组合");
        System.out.printf("%-4s %12s %6s %6s %8s %8s %10s%n",
                "#", "盈亏", "交易", "胜", "胜率", "最大连亏", "最低盈亏");
        printSeparator();
        int rank = 1;
        for (OptimizationStrategy strategy : ranked) {
            StrategyResults results = strategy.getResults();
            System.out.printf("%-4d %12.2f %6d %6d %7.2f%% %8d %10.2f%n",
                    rank++, results.getProfitLoss(), results.getTradeCount(), results.getWinCount(),
                    results.getWinRate() * 100, results.getMaximumConsecutiveLosses(),
                    results.getMinimumProfitLoss());
            System.out.println("     " + strategy.getConfiguration());
        }
        printSeparator();
    }

    @Override
    public void printUsage() {
        printUsageHeader("java -jar forex-optimizer.jar optimize --symbol <symbol> [选项]");
        System.out.println(ANSI_BOLD + "描述:" + ANSI_RESET);
        System.out.println("  未指定参数文件时使用策略内置的参数选项。");
        System.out.println("  可用策略: " + String.join(", ", optimizerService.getAvailableStrategies()));
        System.out.println();
        printOptions(createOptions());
        printExamples();
    }

    protected Options createOptions() {
        Options options = createBaseOptions();
        options.addOption(createOption("s", "symbol", "交易标的 (必需)", true));
        options.addOption(createOption("st", "strategy", "策略名称 (默认 reversals)", true));
        options.addOption(createOption("g", "group", "数据分组", true));
        options.addOption(createOption("o", "options", "参数选项JSON文件", true));
        options.addOption(createOption("i", "investment", "每笔投资额", true));
        options.addOption(createOption("p", "profitability", "盈利收益率", true));
        options.addOption(createOption("t", "top", "输出的组合数量", true));
        return options;
    }
}
