package com.polyglot.codegen.generator;

/**
 * 代码生成配置（不可变）
 *
 * <p>通过 {@link #builder()} 或 {@link com.polyglot.codegen.TargetLanguage#defaultConfig()} 构建。</p>
 */
public final class GeneratorConfig {
    private final String targetVersion;
    private final String namespacePrefix;
    private final int indentWidth;
    private final boolean preserveComments;
    private final boolean useIdiomaticValueObjects;
    private final boolean emitTypedSignatures;
    private final boolean optimize;

    private GeneratorConfig(Builder builder) {
        this.targetVersion = builder.targetVersion;
        this.namespacePrefix = builder.namespacePrefix;
        this.indentWidth = builder.indentWidth;
        this.preserveComments = builder.preserveComments;
        this.useIdiomaticValueObjects = builder.useIdiomaticValueObjects;
        this.emitTypedSignatures = builder.emitTypedSignatures;
        this.optimize = builder.optimize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 以当前配置为起点的构建器 */
    public Builder toBuilder() {
        return new Builder()
                .targetVersion(targetVersion)
                .namespacePrefix(namespacePrefix)
                .indentWidth(indentWidth)
                .preserveComments(preserveComments)
                .useIdiomaticValueObjects(useIdiomaticValueObjects)
                .emitTypedSignatures(emitTypedSignatures)
                .optimize(optimize);
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    /**
     * 目标版本的主版本号，如 "3.2" 取 3、"17" 取 17；无法解析时返回 0
     */
    public int getMajorVersion() {
        return versionPart(0);
    }

    /** 次版本号，缺省为 0 */
    public int getMinorVersion() {
        return versionPart(1);
    }

    /** 目标版本是否不低于 major.minor */
    public boolean isVersionAtLeast(int major, int minor) {
        int m = getMajorVersion();
        return m > major || (m == major && getMinorVersion() >= minor);
    }

    public String getNamespacePrefix() {
        return namespacePrefix;
    }

    public boolean hasNamespacePrefix() {
        return !namespacePrefix.isEmpty();
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public boolean isPreserveComments() {
        return preserveComments;
    }

    public boolean isUseIdiomaticValueObjects() {
        return useIdiomaticValueObjects;
    }

    public boolean isEmitTypedSignatures() {
        return emitTypedSignatures;
    }

    /** 生成前是否先做常量折叠与死代码消除 */
    public boolean isOptimize() {
        return optimize;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentWidth; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }

    private int versionPart(int index) {
        String[] parts = targetVersion.split("\\.");
        if (index >= parts.length) {
            return 0;
        }
        try {
            return Integer.parseInt(parts[index].trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public String toString() {
        return "GeneratorConfig{targetVersion=" + targetVersion
                + ", namespacePrefix=" + namespacePrefix
                + ", indentWidth=" + indentWidth
                + ", preserveComments=" + preserveComments
                + ", useIdiomaticValueObjects=" + useIdiomaticValueObjects
                + ", emitTypedSignatures=" + emitTypedSignatures
                + ", optimize=" + optimize + "}";
    }

    /**
     * 配置构建器
     */
    public static final class Builder {
        private String targetVersion = "1";
        private String namespacePrefix = "";
        private int indentWidth = 4;
        private boolean preserveComments = true;
        private boolean useIdiomaticValueObjects = true;
        private boolean emitTypedSignatures = false;
        private boolean optimize = false;

        private Builder() {
        }

        public Builder targetVersion(String targetVersion) {
            this.targetVersion = targetVersion;
            return this;
        }

        public Builder namespacePrefix(String namespacePrefix) {
            this.namespacePrefix = namespacePrefix != null ? namespacePrefix.trim() : "";
            return this;
        }

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder preserveComments(boolean preserveComments) {
            this.preserveComments = preserveComments;
            return this;
        }

        public Builder useIdiomaticValueObjects(boolean useIdiomaticValueObjects) {
            this.useIdiomaticValueObjects = useIdiomaticValueObjects;
            return this;
        }

        public Builder emitTypedSignatures(boolean emitTypedSignatures) {
            this.emitTypedSignatures = emitTypedSignatures;
            return this;
        }

        public Builder optimize(boolean optimize) {
            this.optimize = optimize;
            return this;
        }

        /**
         * @throws IllegalArgumentException 缩进宽度小于 1 或版本为空
         */
        public GeneratorConfig build() {
            if (indentWidth < 1) {
                throw new IllegalArgumentException("indentWidth 必须为正数: " + indentWidth);
            }
            if (targetVersion == null || targetVersion.trim().isEmpty()) {
                throw new IllegalArgumentException("targetVersion 不能为空");
            }
            targetVersion = targetVersion.trim();
            return new GeneratorConfig(this);
        }
    }
}
