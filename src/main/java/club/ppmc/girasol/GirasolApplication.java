/**
 * GirasolApplication.java
 *
 * 应用的主入口类。
 * 先用 GirasolOptions 解析子命令：endpoint 以 Web 应用方式启动守护进程（WebSocket + REST），
 * 其余子命令以非 Web 方式启动 Spring 上下文，交给 CommandLineService 执行后按其返回码退出。
 */
package club.ppmc.girasol;

import club.ppmc.girasol.model.GirasolCommand;
import club.ppmc.girasol.service.CommandLineService;
import club.ppmc.girasol.util.GirasolOptions;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.cli.ParseException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class GirasolApplication {

    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        var options = new GirasolOptions();
        GirasolCommand command;
        try {
            command = options.parseArgs(args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            options.printHelp(new PrintWriter(System.err));
            System.exit(EXIT_USAGE);
            return;
        }
        if (command instanceof GirasolCommand.Help) {
            options.printHelp(new PrintWriter(System.out));
            return;
        }

        var application = new SpringApplication(GirasolApplication.class);
        String[] springArgs = springArguments(options.home(), command);
        if (command instanceof GirasolCommand.Endpoint) {
            application.setWebApplicationType(WebApplicationType.SERVLET);
            application.run(springArgs);
            return;
        }
        application.setWebApplicationType(WebApplicationType.NONE);
        ConfigurableApplicationContext context = application.run(springArgs);
        int exitCode = context.getBean(CommandLineService.class).execute(command);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    /**
     * 把命令行选项翻译为 Spring 属性参数，使它们覆盖 application.properties 中的默认值。
     */
    static String[] springArguments(String home, GirasolCommand command) {
        List<String> springArgs = new ArrayList<>();
        if (home != null) {
            springArgs.add("--girasol.home=" + home);
        }
        if (command instanceof GirasolCommand.Endpoint endpoint) {
            springArgs.add("--server.address=" + endpoint.host());
            springArgs.add("--server.port=" + endpoint.port());
        }
        return springArgs.toArray(new String[0]);
    }
}
