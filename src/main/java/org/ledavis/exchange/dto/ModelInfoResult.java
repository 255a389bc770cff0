package org.ledavis.exchange.dto;

import java.util.List;

/**
 * {@code p21_read_model_info} 的返回结果：HEADER 段信息 + DATA 段统计。
 *
 * @param rootId              根目录标识
 * @param path                统一后的路径（使用 '/' 分隔）
 * @param decodedWith         解码字符集（例如 {@code UTF-8}/{@code GB18030}）
 * @param fileDescriptions    {@code FILE_DESCRIPTION} 的 description 列表
 * @param implementationLevel {@code FILE_DESCRIPTION} 的实现级别
 * @param fileName            {@code FILE_NAME} 的 name
 * @param timeStamp           {@code FILE_NAME} 的 time_stamp
 * @param authors             {@code FILE_NAME} 的 author 列表
 * @param organizations       {@code FILE_NAME} 的 organization 列表
 * @param preprocessorVersion {@code FILE_NAME} 的 preprocessor_version
 * @param originatingSystem   {@code FILE_NAME} 的 originating_system
 * @param authorization       {@code FILE_NAME} 的 authorization
 * @param schemas             {@code FILE_SCHEMA} 列表
 * @param productNames        DATA 段中 {@code PRODUCT(...)} 的 name（仅作名称线索）
 * @param entityCount         实例总数
 * @param danglingReferences  悬空引用的 id 数（去重）
 * @param entityTypes         实体类型计数（按数量降序、名称升序）
 * @param warnings            非致命告警
 */
public record ModelInfoResult(
        String rootId,
        String path,
        String decodedWith,
        List<String> fileDescriptions,
        String implementationLevel,
        String fileName,
        String timeStamp,
        List<String> authors,
        List<String> organizations,
        String preprocessorVersion,
        String originatingSystem,
        String authorization,
        List<String> schemas,
        List<String> productNames,
        int entityCount,
        int danglingReferences,
        List<EntityTypeCount> entityTypes,
        List<String> warnings
) {
}
