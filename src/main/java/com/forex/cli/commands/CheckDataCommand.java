package com.forex.cli.commands;

import com.forex.cli.AbstractCommand;
import com.forex.cli.CommandException;
import com.forex.optimizer.DatasetLoadException;
import com.forex.repository.StorageGateway;
import lombok.RequiredArgsConstructor;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 数据检查命令
 */
@Component
@RequiredArgsConstructor
public class CheckDataCommand extends AbstractCommand {

    private final StorageGateway storageGateway;

    @Override
    public String getName() {
        return "check-data";
    }

    @Override
    public String getDescription() {
        return "统计指定标的已准备的数据点数量";
    }

    @Override
    public List<String> getExamples() {
        return List.of("check-data --symbol EURUSD");
    }

    @Override
    public void execute(String[] args) throws CommandException {
        CommandLine cmd = parseArgs(args, createOptions());
        if (shouldShowHelp(cmd)) {
            printUsage();
            return;
        }
        validateRequired(cmd, "symbol");

        String symbol = cmd.getOptionValue("symbol");
        try {
            long count = storageGateway.countMatching(symbol);
            if (count == 0) {
                printWarning("未找到 " + symbol + " 的数据");
            } else {
                printSuccess(String.format("%s 共有 %d 个数据点", symbol, count));
            }
        } catch (DatasetLoadException e) {
            throw CommandException.executionFailed(getName(), e.getMessage(), e);
        }
    }

    @Override
    public void printUsage() {
        printUsageHeader("java -jar forex-optimizer.jar check-data --symbol <symbol>");
        printOptions(createOptions());
        printExamples();
    }

    protected Options createOptions() {
        Options options = createBaseOptions();
        options.addOption(createOption("s", "symbol", "交易标的 (必需)", true));
        return options;
    }
}
