package com.sqlitesession.infrastructure.dao;

import com.sqlitesession.infrastructure.dao.po.SessionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 会话 DAO
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Mapper
public interface SessionDao {

    /**
     * 插入会话
     */
    int insert(SessionPO po);

    /**
     * 根据会话 ID 删除（外键级联删除子表）
     */
    int deleteById(@Param("sessionId") String sessionId);

    /**
     * 根据会话 ID 查询
     */
    SessionPO selectById(@Param("sessionId") String sessionId);

    /**
     * 统计会话是否存在
     */
    int countById(@Param("sessionId") String sessionId);
}
