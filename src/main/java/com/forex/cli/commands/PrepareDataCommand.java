package com.forex.cli.commands;

import com.forex.cli.AbstractCommand;
import com.forex.cli.CommandException;
import com.forex.config.OptimizerProperties;
import com.forex.domain.vo.Tick;
import com.forex.optimizer.OptimizerService;
import com.forex.optimizer.PreparationResult;
import com.forex.service.TickCsvReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 数据准备命令
 * 读取CSV行情，计算策略所需指标并写入存储
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PrepareDataCommand extends AbstractCommand {

    private final OptimizerService optimizerService;
    private final TickCsvReader tickCsvReader;
    private final OptimizerProperties properties;

    @Override
    public String getName() {
        return "prepare";
    }

    @Override
    public String getDescription() {
        return "读取行情CSV，计算指标并写入数据库";
    }

    @Override
    public List<String> getExamples() {
        return List.of(
                "prepare --file data/EURUSD.csv --symbol EURUSD",
                "prepare --file data/GBPUSD.csv --symbol GBPUSD --strategy reversals"
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
        validateRequired(cmd, "file", "symbol");

        Path file = Path.of(cmd.getOptionValue("file"));
        String symbol = cmd.getOptionValue("symbol");
        String strategy = getOptionValue(cmd, "strategy", properties.getBacktest().getStrategy());
        if (!Files.isRegularFile(file)) {
            throw CommandException.invalidArgument(getName(), "文件不存在: " + file);
        }

        try {
            List<Tick> ticks = tickCsvReader.read(file);
            printInfo(String.format("读取 %d 个Tick, 开始为策略 %s 准备 %s 数据...", ticks.size(), strategy, symbol));

            PreparationResult result = optimizerService.prepareData(strategy, symbol, ticks);

            printTableHeader("数据准备结果");
            System.out.print(result.getSummary());
            printSeparator();
            if (result.isSuccessful()) {
                printSuccess("数据准备完成");
            } else {
                printWarning(String.format("数据准备完成, %d 个批次写入失败", result.getFailedBatches().size()));
            }
        } catch (IOException e) {
            throw CommandException.executionFailed(getName(), "读取CSV失败: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw CommandException.invalidArgument(getName(), e.getMessage());
        }
    }

    @Override
    public void printUsage() {
        printUsageHeader("java -jar forex-optimizer.jar prepare --file <csv> --symbol <symbol> [选项]");
        System.out.println(ANSI_BOLD + "描述:" + ANSI_RESET);
        System.out.println("  CSV首行为表头: timestamp,open,high,low,close[,testingGroups,validationGroups]");
        System.out.println();
        printOptions(createOptions());
        printExamples();
    }

    protected Options createOptions() {
        Options options = createBaseOptions();
        options.addOption(createOption("f", "file", "行情CSV文件 (必需)", true));
        options.addOption(createOption("s", "symbol", "交易标的 (必需)", true));
        options.addOption(createOption("st", "strategy", "策略名称 (默认 reversals)", true));
        return options;
    }
}
