package org.jointresolver.kinematics;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 运动树合成服务的 Bean 装配。
 * <p>
 * 合成算法本身是无状态的静态方法；这里只把配置 {@link KinematicsProperties} 注入到文档读取器与流水线门面中。
 */
@Configuration(proxyBeanMethods = false)
public class KinematicsConfiguration {

    @Bean
    public AssemblyDocumentReader assemblyDocumentReader(KinematicsProperties properties) {
        return new AssemblyDocumentReader(
                properties.getMaxDocumentSize().toBytes(),
                properties.getMaxGroups(),
                properties.getMaxJoints()
        );
    }

    @Bean
    public KinematicTreeSynthesizer kinematicTreeSynthesizer(KinematicsProperties properties) {
        return new KinematicTreeSynthesizer(new KinematicTreeSynthesizer.Options(properties.isFailOnDisconnected()));
    }
}
