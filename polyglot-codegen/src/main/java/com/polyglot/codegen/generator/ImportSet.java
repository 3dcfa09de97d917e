package com.polyglot.codegen.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * 导入集合：去重并按字母序排列。
 *
 * <p>文件头写出后调用 {@link #freeze()}；之后新增的条目已无法出现在输出中，只记录警告。</p>
 */
public class ImportSet {
    private static final Logger LOG = Logger.getLogger(ImportSet.class.getName());

    private final Set<String> entries = new TreeSet<>();
    private boolean frozen = false;

    /**
     * 加入一条导入
     *
     * @return 是否为新条目
     */
    public boolean add(String entry) {
        if (entries.contains(entry)) {
            return false;
        }
        if (frozen) {
            LOG.warning("导入在文件头写出后才出现，已忽略: " + entry);
            return false;
        }
        entries.add(entry);
        return true;
    }

    public boolean contains(String entry) {
        return entries.contains(entry);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** 已排序的条目快照 */
    public List<String> toSortedList() {
        return new ArrayList<>(entries);
    }
}
