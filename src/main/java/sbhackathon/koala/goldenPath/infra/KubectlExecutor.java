package sbhackathon.koala.goldenPath.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import sbhackathon.koala.goldenPath.config.KubernetesConfig;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

@Component
public class KubectlExecutor {

    private static final Logger logger = LoggerFactory.getLogger(KubectlExecutor.class);

    static final String IN_CLUSTER_HOST_VARIABLE = "KUBERNETES_SERVICE_HOST";

    private final KubernetesConfig kubernetesConfig;
    private final Map<String, String> environment;

    @Autowired
    public KubectlExecutor(KubernetesConfig kubernetesConfig) {
        this(kubernetesConfig, System.getenv());
    }

    KubectlExecutor(KubernetesConfig kubernetesConfig, Map<String, String> environment) {
        this.kubernetesConfig = kubernetesConfig;
        this.environment = environment;
    }

    /**
     * kubectl apply -f - 명령을 실행하여 YAML을 적용합니다.
     *
     * @param yaml 적용할 Kubernetes YAML 문자열
     * @return kubectl 표준 출력
     * @throws RuntimeException kubectl 실행 실패 또는 시간 초과 시
     */
    public String applyYaml(String yaml) {
        logger.info("kubectl apply 실행 시작");
        logger.debug("적용할 YAML:\n{}", yaml);
        return execute(command("apply", "-f", "-"), yaml, "apply");
    }

    /**
     * 리소스를 삭제합니다. 존재하지 않는 리소스는 오류로 취급하지 않습니다.
     *
     * @return kubectl 표준 출력 (리소스가 없으면 빈 문자열)
     */
    public String deleteResource(String kind, String name, String namespace) {
        logger.info("kubectl delete 실행 시작: {} {} -n {}", kind, name, namespace);
        return execute(command("delete", kind, name, "-n", namespace, "--ignore-not-found"), null, "delete");
    }

    /**
     * kubectl 명령이 사용 가능한지 확인합니다.
     *
     * @return kubectl 명령 사용 가능 여부
     */
    public boolean isKubectlAvailable() {
        boolean available = probe("version", "version", "--client").isPresent();
        if (available) {
            logger.info("kubectl 명령 사용 가능");
        }
        return available;
    }

    /**
     * 클러스터 접속 정보가 있는지 확인합니다. 파드 내부에서 실행 중이면 서비스 어카운트를 사용하고,
     * 그 외에는 kubeconfig에 현재 컨텍스트가 설정되어 있어야 합니다.
     */
    public boolean hasClusterContext() {
        String inClusterHost = environment.get(IN_CLUSTER_HOST_VARIABLE);
        if (inClusterHost != null && !inClusterHost.isBlank()) {
            logger.info("클러스터 내부 실행 감지: {}", inClusterHost);
            return true;
        }

        Optional<String> context = probe("config current-context", "config", "current-context")
                .filter(output -> !output.isBlank());
        context.ifPresent(name -> logger.info("kubectl 현재 컨텍스트: {}", name));
        return context.isPresent();
    }

    /**
     * 클러스터에 변경을 가하지 않는 명령을 실행합니다.
     *
     * @return 종료 코드 0일 때의 출력, 실패나 시간 초과 시 empty
     */
    private Optional<String> probe(String description, String... args) {
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command(args));
            processBuilder.redirectErrorStream(true);
            Process process = processBuilder.start();
            process.getOutputStream().close();
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readLines(process.getInputStream(), false));

            if (!process.waitFor(kubernetesConfig.getKubectlTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                logger.warn("kubectl {} 시간 초과", description);
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                logger.warn("kubectl {} 실패 (exit code: {}): {}", description, process.exitValue(), output.get().trim());
                return Optional.empty();
            }
            return Optional.of(output.get().trim());
        } catch (IOException e) {
            logger.warn("kubectl 사용 불가능: {}", e.getMessage());
            return Optional.empty();
        } catch (ExecutionException e) {
            logger.warn("kubectl {} 출력 읽기 실패: {}", description, e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("kubectl {} 확인 중 인터럽트 발생", description);
            return Optional.empty();
        }
    }

    private String execute(List<String> command, String stdin, String action) {
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(false);

        try {
            Process process = processBuilder.start();

            // stdout/stderr를 동시에 읽어 파이프 버퍼로 인한 교착을 피합니다
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readLines(process.getInputStream(), false));
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readLines(process.getErrorStream(), true));

            IOException stdinFailure = writeStdin(process, stdin, action);

            long timeout = kubernetesConfig.getKubectlTimeoutSeconds();
            if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                String errorMessage = String.format("kubectl %s 시간 초과 (%d초)", action, timeout);
                logger.error(errorMessage);
                throw new RuntimeException(errorMessage);
            }

            int exitCode = process.exitValue();
            logger.info("kubectl {} 종료 코드: {}", action, exitCode);

            String output = stdout.get();
            if (exitCode != 0) {
                String errorMessage = String.format(
                        "kubectl %s 실패 (exit code: %d). Error: %s",
                        action,
                        exitCode,
                        stderr.get().trim()
                );
                logger.error(errorMessage);
                throw new RuntimeException(errorMessage);
            }
            if (stdinFailure != null) {
                String errorMessage = String.format("kubectl %s 입력 전달 실패: %s", action, stdinFailure.getMessage());
                logger.error(errorMessage);
                throw new RuntimeException(errorMessage, stdinFailure);
            }

            logger.info("kubectl {} 성공: {}", action, output.trim());
            return output.trim();

        } catch (IOException e) {
            String errorMessage = "kubectl 프로세스 실행 중 IO 오류 발생: " + e.getMessage();
            logger.error(errorMessage, e);
            throw new RuntimeException(errorMessage, e);
        } catch (ExecutionException e) {
            String errorMessage = "kubectl 출력 읽기 실패: " + e.getCause().getMessage();
            logger.error(errorMessage, e);
            throw new RuntimeException(errorMessage, e.getCause());
        } catch (InterruptedException e) {
            String errorMessage = "kubectl 프로세스 대기 중 인터럽트 발생: " + e.getMessage();
            logger.error(errorMessage, e);
            Thread.currentThread().interrupt();
            throw new RuntimeException(errorMessage, e);
        }
    }

    /**
     * 프로세스가 입력을 읽기 전에 종료되면 쓰기가 실패합니다. 이 경우 종료 코드와 stderr로 원인을
     * 보고할 수 있도록 예외를 던지지 않고 반환합니다.
     */
    private static IOException writeStdin(Process process, String stdin, String action) {
        try (BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8))) {
            if (stdin != null) {
                writer.write(stdin);
                writer.flush();
            }
            return null;
        } catch (IOException e) {
            logger.warn("kubectl {} 표준 입력 쓰기 실패: {}", action, e.getMessage());
            return e;
        }
    }

    private List<String> command(String... args) {
        List<String> command = new ArrayList<>();
        command.add(kubernetesConfig.getKubectlCommand());
        command.addAll(List.of(args));
        return command;
    }

    private static String readLines(InputStream stream, boolean error) {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
                if (error) {
                    logger.error("kubectl stderr: {}", line);
                } else {
                    logger.info("kubectl stdout: {}", line);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output.toString();
    }
}
