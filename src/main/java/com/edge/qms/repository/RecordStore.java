package com.edge.qms.repository;

import com.edge.qms.model.DateRange;
import com.edge.qms.model.InspectionRecord;
import com.edge.qms.model.MeasurementItem;

import java.util.List;
import java.util.Optional;

/**
 * 检验记录存储
 * <p>
 * 同一次读取内保持稳定的插入顺序；返回的都是不可变值对象。
 */
public interface RecordStore {

    /**
     * 获取某模板下的记录，按时间正序（插入顺序）
     *
     * @param range 可选日期范围（按创建日期过滤），null 表示不限
     */
    List<InspectionRecord> getRecordsForTemplate(String templateId, DateRange range);

    /**
     * 获取记录的测量项，按存储顺序
     */
    List<MeasurementItem> getItemsForRecord(String recordId);

    Optional<InspectionRecord> findById(String id);

    /**
     * 按时间正序返回日期范围内的全部记录
     */
    List<InspectionRecord> findAll(DateRange range);

    /**
     * 最新的 limit 条记录，按时间倒序
     */
    List<InspectionRecord> findRecent(int limit);

    InspectionRecord insert(InspectionRecord record);

    void update(InspectionRecord record);

    void delete(String id);

    long count();
}
