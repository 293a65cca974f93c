package com.initialone.jmigrate.migrate;

/** 参数组合或迁移目录不合法；在任何文件 I/O 之前抛出。 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
