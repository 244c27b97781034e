package org.csu.jfor.engine;

import org.csu.jfor.common.exception.JforException;
import org.csu.jfor.common.model.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 封装一次脚本执行的所有结果信息。
 */
public record ScriptResult(
        String output,                  // print 语句产生的全部输出
        JforException error,            // 失败时的错误，成功时为 null
        Map<String, Value> variables    // 执行结束 (或出错) 时的变量表快照
) {
    public static ScriptResult success(String output, Map<String, Value> variables) {
        return new ScriptResult(output, null, variables);
    }

    public static ScriptResult failure(String output, JforException error, Map<String, Value> variables) {
        return new ScriptResult(output, error, variables);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return 按行拆分的输出，每条执行过的 print 对应一行 (包括空字符串)
     */
    public List<String> outputLines() {
        List<String> lines = Arrays.asList(output.split("\\R", -1));
        // 最后一个换行符之后的空串不是一行
        if (lines.get(lines.size() - 1).isEmpty()) {
            return lines.subList(0, lines.size() - 1);
        }
        return lines;
    }
}
