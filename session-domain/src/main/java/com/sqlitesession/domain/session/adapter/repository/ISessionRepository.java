package com.sqlitesession.domain.session.adapter.repository;

import com.sqlitesession.domain.session.model.entity.SessionAgentEntity;
import com.sqlitesession.domain.session.model.entity.SessionEntity;
import com.sqlitesession.domain.session.model.entity.SessionMessageEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 会话状态仓储接口。
 * <p>
 * 层级关系：Session → Agent → Message，Multi-agent 状态直接挂在 Session 下。
 * 所有方法同步阻塞，每条语句自动提交。
 * </p>
 * <p>
 * 缺失语义按操作区分，调用方依赖该区分：
 * <ul>
 *   <li>{@link #readSession} / {@link #readAgent} 返回 {@link Optional#empty()}</li>
 *   <li>{@link #readMessage} / {@link #readMultiAgent} / update* / {@link #deleteSession}
 *   抛出 {@link com.sqlitesession.types.exception.EntityNotFoundException}</li>
 * </ul>
 * </p>
 * <p>
 * 载荷以 JSON 文本存储，读取结果按 JSON 类型重建：整数在 int 范围内读回为 {@link Integer}，超出时为
 * {@link Long}；小数一律读回为 {@link Double}；嵌套对象与数组读回为 {@link java.util.LinkedHashMap} 与
 * {@link java.util.ArrayList}。写入 {@code Long}/{@code Float} 等值时，读回的 Map 与原 Map 不一定 equals，
 * 比较时应按数值比较。
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
public interface ISessionRepository {

    /**
     * 创建会话，ID 已存在时抛出 DuplicateEntityException。
     */
    void createSession(SessionEntity session);

    /**
     * 读取会话，不存在时返回空。
     */
    Optional<SessionEntity> readSession(String sessionId);

    /**
     * 删除会话，级联删除其下全部 Agent、消息与 Multi-agent 状态。
     */
    void deleteSession(String sessionId);

    /**
     * 创建 Agent，会话不存在时抛出 EntityNotFoundException。
     */
    void createAgent(String sessionId, SessionAgentEntity agent);

    /**
     * 读取 Agent，不存在时返回空。
     */
    Optional<SessionAgentEntity> readAgent(String sessionId, String agentId);

    /**
     * 覆盖更新 Agent，不存在时抛出 EntityNotFoundException（不做 upsert）。
     */
    void updateAgent(String sessionId, SessionAgentEntity agent);

    /**
     * 创建消息，Agent 不存在时抛出 EntityNotFoundException。
     */
    void createMessage(String sessionId, String agentId, SessionMessageEntity message);

    /**
     * 读取消息，不存在时抛出 EntityNotFoundException。
     */
    SessionMessageEntity readMessage(String sessionId, String agentId, int messageId);

    /**
     * 覆盖更新消息，不存在时抛出 EntityNotFoundException。
     */
    void updateMessage(String sessionId, String agentId, SessionMessageEntity message);

    /**
     * 按 messageId 升序分页查询消息。
     *
     * @param limit 为空时返回全部消息并忽略 offset
     * @param offset 跳过的条数
     */
    List<SessionMessageEntity> listMessages(String sessionId, String agentId, Integer limit, int offset);

    /**
     * 按 messageId 升序查询全部消息。
     */
    default List<SessionMessageEntity> listMessages(String sessionId, String agentId) {
        return listMessages(sessionId, agentId, null, 0);
    }

    /**
     * 创建 Multi-agent 状态，会话不存在时抛出 EntityNotFoundException。
     */
    void createMultiAgent(String sessionId, String multiAgentId, Map<String, Object> state);

    /**
     * 读取 Multi-agent 状态，不存在时抛出 EntityNotFoundException。
     */
    Map<String, Object> readMultiAgent(String sessionId, String multiAgentId);

    /**
     * 覆盖更新 Multi-agent 状态，不存在时抛出 EntityNotFoundException。
     */
    void updateMultiAgent(String sessionId, String multiAgentId, Map<String, Object> state);
}
