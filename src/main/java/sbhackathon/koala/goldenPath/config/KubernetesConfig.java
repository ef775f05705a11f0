package sbhackathon.koala.goldenPath.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "k8s")
public class KubernetesConfig {

    /**
     * 배포 대상 네임스페이스 (Argo CD가 리소스를 동기화할 곳)
     */
    private String namespace = "default";
    /**
     * kubectl 실행 파일 (PATH 상의 이름 또는 절대 경로)
     */
    private String kubectlCommand = "kubectl";
    private long kubectlTimeoutSeconds = 60;
    private ArgoCd argocd = new ArgoCd();

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getKubectlCommand() {
        return kubectlCommand;
    }

    public void setKubectlCommand(String kubectlCommand) {
        this.kubectlCommand = kubectlCommand;
    }

    public long getKubectlTimeoutSeconds() {
        return kubectlTimeoutSeconds;
    }

    public void setKubectlTimeoutSeconds(long kubectlTimeoutSeconds) {
        this.kubectlTimeoutSeconds = kubectlTimeoutSeconds;
    }

    public ArgoCd getArgocd() {
        return argocd;
    }

    public void setArgocd(ArgoCd argocd) {
        this.argocd = argocd;
    }

    public static class ArgoCd {
        private String namespace = "argocd";
        private String project = "default";
        private String destinationServer = "https://kubernetes.default.svc";
        private String targetRevision = "HEAD";
        private String path = ".";

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public String getProject() {
            return project;
        }

        public void setProject(String project) {
            this.project = project;
        }

        public String getDestinationServer() {
            return destinationServer;
        }

        public void setDestinationServer(String destinationServer) {
            this.destinationServer = destinationServer;
        }

        public String getTargetRevision() {
            return targetRevision;
        }

        public void setTargetRevision(String targetRevision) {
            this.targetRevision = targetRevision;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
