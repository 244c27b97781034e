package org.csu.jfor.cli;

import org.csu.jfor.common.config.JforConfig;
import org.csu.jfor.common.exception.JforException;
import org.csu.jfor.engine.ScriptProcessor;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * @description: 命令行入口
 *
 * 用法:
 *   ScriptRunner demo            运行内置演示程序
 *   ScriptRunner yourfile.jfor   运行脚本文件
 *
 * 退出码: 0 成功；1 读取文件失败或脚本出错；2 参数错误。
 */
public class ScriptRunner {

    public static final String DEMO_ARGUMENT = "demo";
    public static final String SCRIPT_SUFFIX = ".jfor";

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private final JforConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public ScriptRunner(JforConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        ScriptRunner runner = new ScriptRunner(JforConfig.fromSystemProperties(), System.out, System.err);
        System.exit(runner.run(args));
    }

    public int run(String... args) {
        if (args.length != 1) {
            printUsage();
            return EXIT_USAGE;
        }
        String source;
        if (DEMO_ARGUMENT.equals(args[0])) {
            source = DemoScript.SOURCE;
        } else if (args[0].endsWith(SCRIPT_SUFFIX)) {
            try {
                source = Files.readString(Path.of(args[0]), config.getSourceCharset());
            } catch (IOException e) {
                err.println("Cannot read script '" + args[0] + "': " + e.getMessage());
                return EXIT_ERROR;
            }
        } else {
            err.println("Not a jfor script: " + args[0]);
            printUsage();
            return EXIT_USAGE;
        }

        try {
            new ScriptProcessor(config).execute(source, out);
            out.flush();
            return EXIT_OK;
        } catch (JforException e) {
            out.flush();
            err.println(e.describe());
            return EXIT_ERROR;
        }
    }

    private void printUsage() {
        err.println("Usage:");
        err.println("  ScriptRunner " + DEMO_ARGUMENT);
        err.println("  ScriptRunner yourfile" + SCRIPT_SUFFIX);
    }
}
