package xyz.vvrf.o2a.core;

import java.util.List;

/**
 * 可接受 {@code <file>} 引用的映射器能力。
 *
 * @author ruifeng.wen
 */
public interface FileCapable {

    /**
     * 添加一个文件引用，格式为 {@code path[#symlink]}。
     *
     * @param filePath 原始文件引用文本
     */
    void addFile(String filePath);

    /**
     * @return 已添加文件引用的不可变列表
     */
    List<String> getFiles();
}
