package org.ledavis.exchange.files;

import org.ledavis.exchange.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 把工具调用传入的路径解析为根目录白名单内的绝对路径。
 * <ul>
 *   <li>相对路径：相对 rootId 指定的根目录（为空时使用 root0）</li>
 *   <li>绝对路径：匹配层级最深的根目录</li>
 *   <li>逐级检查已存在的路径段，拒绝 {@code ../} 越界以及符号链接/junction 逃逸</li>
 * </ul>
 */
public class SecurePathResolver {

    private final boolean allowSymlink;
    private final List<Root> roots;

    public SecurePathResolver(ExchangeFileProperties properties) {
        this(properties.getRoots(), properties.isAllowSymlink());
    }

    public SecurePathResolver(List<String> roots, boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
        this.roots = normalizeRoots(roots);
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.rootPath().toString()));
        }
        return result;
    }

    /**
     * 解析一个必须已存在的输入文件。
     */
    public ResolvedPath resolveExisting(String rootId, String inputPath) {
        return resolve(rootId, inputPath, true);
    }

    /**
     * 解析一个输出文件：文件本身可以不存在，但父目录必须存在且位于根目录内。
     */
    public ResolvedPath resolveForWrite(String rootId, String inputPath) {
        ResolvedPath resolved = resolve(rootId, inputPath, false);
        Path parent = resolved.absolutePath().getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            throw new IllegalArgumentException("输出目录不存在：" + resolved.displayPath());
        }
        if (resolved.absolutePath().equals(resolved.rootPath())) {
            throw new IllegalArgumentException("输出路径不能是根目录本身：" + inputPath);
        }
        return resolved;
    }

    ResolvedPath resolve(String rootId, String inputPath, boolean requireExists) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.p21.roots）");
        }
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("路径不能为空");
        }

        Path rawPath = Path.of(inputPath);
        Root root;
        Path absolute;
        if (rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            root = isBlank(rootId) ? bestRootFor(absolute) : rootById(rootId);
        } else {
            root = isBlank(rootId) ? roots.get(0) : rootById(rootId);
            absolute = root.rootPath().resolve(rawPath).normalize();
        }
        if (!absolute.startsWith(root.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }
        if (requireExists && !Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + inputPath);
        }
        checkLinks(root, absolute);
        return new ResolvedPath(root.id(), root.rootPath(), absolute, displayPath(root, absolute));
    }

    private void checkLinks(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }

        // 逐级检查：中间任意一级是链接都可能把后续路径带出根目录
        Path current = root.rootPath();
        for (Path segment : root.rootPath().relativize(absolute)) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (!allowSymlink && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            Path real;
            try {
                real = current.toRealPath();
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
            if (!real.startsWith(rootReal)) {
                throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + current);
            }
        }
    }

    private Root rootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root bestRootFor(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.p21.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        return root.rootPath().relativize(absolute).toString().replace('\\', '/');
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Root(String id, Path rootPath) {
    }

    /**
     * @param rootId       命中的根目录标识
     * @param rootPath     根目录绝对路径
     * @param absolutePath 解析后的绝对路径
     * @param displayPath  相对根目录、以 '/' 分隔的路径
     */
    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
