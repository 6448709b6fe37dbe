package com.nexus.graph;

/**
 * 实体物化数据源统一接口
 *
 * 提供进程内遍历和数据库存储过程两种实现，运行时根据 nexus.materializer.mode 选择。
 * 两种实现的原始输出都要经过 ResponseStandardizer 规范化，保证结构完全一致。
 */
public interface IModelGraphSource {

    /**
     * 读取实体的一跳完整视图（未规范化）
     *
     * 结构：{model:{id,title,body,created_at,updated_at,model_type}, attributes, relations}
     *
     * @param modelId 实体ID
     * @return 原始嵌套结构；实体不存在时返回 null
     */
    Object loadModelFull(Long modelId);

    /**
     * 获取数据源类型
     *
     * @return IN_PROCESS 或 STORED_ROUTINE
     */
    String getSourceType();
}
