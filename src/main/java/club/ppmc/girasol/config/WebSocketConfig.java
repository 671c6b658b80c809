/**
 * WebSocketConfig.java
 *
 * 配置守护进程的 WebSocket 命令端点。
 * 客户端连接 /girasol 后，每个文本帧就是一个命令，回复和异步通知都从同一连接返回，
 * 具体处理由 CommandDispatcher 完成。只在以 endpoint 子命令启动 Web 服务时生效。
 */
package club.ppmc.girasol.config;

import club.ppmc.girasol.controller.CommandDispatcher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ENDPOINT = "/girasol";

    private final CommandDispatcher commandDispatcher;

    public WebSocketConfig(CommandDispatcher commandDispatcher) {
        this.commandDispatcher = commandDispatcher;
    }

    /**
     * 注册命令端点。
     * 允许任意来源连接：守护进程默认只监听本机地址，访问控制交给部署环境。
     */
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(commandDispatcher, ENDPOINT).setAllowedOriginPatterns("*");
    }
}
