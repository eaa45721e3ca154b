package xyz.vvrf.o2a.core;

import java.util.List;

/**
 * 可接受 {@code <archive>} 引用的映射器能力。
 *
 * @author ruifeng.wen
 */
public interface ArchiveCapable {

    /**
     * 添加一个归档引用，格式为 {@code path[#symlink]}。
     *
     * @param archivePath 原始归档引用文本
     */
    void addArchive(String archivePath);

    /**
     * @return 已添加归档引用的不可变列表
     */
    List<String> getArchives();
}
